package com.ogt.jobs.worker;

import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.config.RabbitMQConfig;
import com.ogt.jobs.config.WorkerIdentity;
import com.ogt.jobs.service.JobLease;
import com.ogt.jobs.service.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Reclama jobs pendientes mientras haya hilos libres y los entrega al pool.
 * Se despierta por RabbitMQ y además consulta la tabla en forma periódica,
 * así un aviso perdido sólo demora el job hasta el próximo poll.
 */
@Slf4j
@Component
public class JobDispatcher {

    private final JobStore jobStore;
    private final JobWorker jobWorker;
    private final WorkerIdentity workerIdentity;
    private final TaskExecutor executor;
    private final Semaphore freeWorkers;

    public JobDispatcher(JobStore jobStore,
                         JobWorker jobWorker,
                         WorkerIdentity workerIdentity,
                         @Qualifier("jobWorkerExecutor") TaskExecutor executor,
                         JobProperties properties) {
        this.jobStore = jobStore;
        this.jobWorker = jobWorker;
        this.workerIdentity = workerIdentity;
        this.executor = executor;
        this.freeWorkers = new Semaphore(Math.max(1, properties.getWorker().getThreads()));
    }

    @RabbitListener(queues = RabbitMQConfig.DISPATCH_QUEUE)
    public void onWakeUp(String jobId) {
        log.debug("📨 Aviso de despacho recibido: {}", jobId);
        dispatch();
    }

    @Scheduled(fixedDelayString = "${jobs.dispatch.poll-interval:PT5S}")
    public void poll() {
        dispatch();
    }

    /**
     * @return cantidad de jobs entregados al pool en esta pasada
     */
    public int dispatch() {
        int started = 0;
        while (freeWorkers.tryAcquire()) {
            Optional<JobLease> lease;
            try {
                lease = jobStore.claimNext(workerIdentity.newLeaseOwner());
            } catch (RuntimeException e) {
                freeWorkers.release();
                throw e;
            }
            if (lease.isEmpty()) {
                freeWorkers.release();
                break;
            }
            if (!handOff(lease.get())) break;
            started++;
        }
        if (started > 0) {
            log.info("🚀 {} job(s) despachados por {}", started, workerIdentity.getId());
        }
        return started;
    }

    private boolean handOff(JobLease lease) {
        try {
            executor.execute(() -> {
                try {
                    jobWorker.execute(lease);
                } finally {
                    freeWorkers.release();
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            freeWorkers.release();
            // El lease vence y el monitor lo devuelve a PENDING
            log.error("❌ Pool rechazó el job {}; queda para el monitor de leases", lease.getJobId(), e);
            return false;
        }
    }
}
