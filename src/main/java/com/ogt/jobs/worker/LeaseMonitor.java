package com.ogt.jobs.worker;

import com.ogt.jobs.service.JobDispatchPublisher;
import com.ogt.jobs.service.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Devuelve a la cola los jobs de workers caídos (lease vencido).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeaseMonitor {

    private final JobStore jobStore;
    private final JobDispatchPublisher dispatchPublisher;

    @Scheduled(fixedDelayString = "${jobs.lease.check-interval:PT15S}")
    public void check() {
        requeueExpired();
    }

    public List<UUID> requeueExpired() {
        List<UUID> requeued = jobStore.requeueExpiredLeases();
        if (!requeued.isEmpty()) {
            log.warn("⏰ {} job(s) reencolados por lease vencido", requeued.size());
            requeued.forEach(dispatchPublisher::publishWakeUp);
        }
        return requeued;
    }
}
