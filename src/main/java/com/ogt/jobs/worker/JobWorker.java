package com.ogt.jobs.worker;

import com.ogt.jobs.entity.Job;
import com.ogt.jobs.service.JobLease;
import com.ogt.jobs.service.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ejecuta un job ya reclamado. Los fallos sistémicos terminan en FAILED; la
 * pérdida del lease corta en silencio porque el job ya tiene otro dueño o estado.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobWorker {

    private final JobStore jobStore;
    private final ImportWorker importWorker;
    private final ReportWorker reportWorker;

    public void execute(JobLease lease) {
        Job job = jobStore.find(lease.getJobId()).orElse(null);
        if (job == null) {
            log.error("❌ Job {} reclamado pero inexistente", lease.getJobId());
            return;
        }

        log.info("▶️ [Job Worker] Procesando job {} ({}, scope {}, intento #{})",
                job.getId(), job.getType(), job.getScopeId(), job.getRetryCount());

        try {
            if (job.getType().isImport()) {
                importWorker.process(job, lease);
            } else {
                reportWorker.process(job, lease);
            }
        } catch (LeaseLostException e) {
            log.info("⏹️ {}", e.getMessage());
        } catch (Exception e) {
            log.error("❌ Error procesando job {}", job.getId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (jobStore.fail(lease, message)) {
                log.info("❌ Job {} marcado como FAILED: {}", job.getId(), message);
            }
        }
    }
}
