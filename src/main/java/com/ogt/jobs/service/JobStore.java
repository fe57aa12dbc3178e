package com.ogt.jobs.service;

import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobAttempt;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.exception.InvalidJobTransitionException;
import com.ogt.jobs.exception.ResourceNotFoundException;
import com.ogt.jobs.repository.JobAttemptRepository;
import com.ogt.jobs.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Máquina de estados del job sobre la tabla {@code jobs}.
 *
 * <pre>
 * PENDING --claim--> PROCESSING --complete--> COMPLETED
 *                    PROCESSING --fail------> FAILED
 * PENDING|PROCESSING --cancel--> CANCELLED
 * FAILED|CANCELLED --retry--> PENDING          (retryCount + 1)
 * PROCESSING --lease vencido--> PENDING         (retryCount sin cambios)
 * </pre>
 *
 * Cada método es una transacción corta con un único UPDATE condicional.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    static final int CANCEL_ATTEMPTS = 3;

    private final JobRepository jobRepository;
    private final JobAttemptRepository attemptRepository;
    private final JobProperties properties;
    private final Clock clock;

    @Transactional
    public Job create(Job job) {
        LocalDateTime now = now();
        job.setStatus(JobStatus.PENDING);
        job.setProcessedCount(0);
        job.setSuccessCount(0);
        job.setFailureCount(0);
        job.setRetryCount(0);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return jobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public Optional<Job> find(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    @Transactional(readOnly = true)
    public Job get(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    @Transactional(readOnly = true)
    public List<JobAttempt> attempts(UUID jobId) {
        return attemptRepository.findByJobIdOrderByAttemptNumberAsc(jobId);
    }

    // ========== LADO WORKER ==========

    /**
     * Claim de un job concreto. Vacío si ya no está PENDING.
     */
    @Transactional
    public Optional<JobLease> claim(UUID jobId, String owner) {
        LocalDateTime now = now();
        int updated = jobRepository.claim(jobId, owner, leaseUntil(now), now,
                JobStatus.PENDING, JobStatus.PROCESSING);
        if (updated == 0) {
            return Optional.empty();
        }
        log.info("🔒 Job {} reclamado por {}", jobId, owner);
        return Optional.of(new JobLease(jobId, owner));
    }

    /**
     * Claim del próximo job pendiente por prioridad y antigüedad. Los
     * candidatos que otro worker gana en el camino se saltean.
     */
    @Transactional
    public Optional<JobLease> claimNext(String owner) {
        List<UUID> candidates = jobRepository.findIdsByStatusOrdered(JobStatus.PENDING,
                PageRequest.of(0, properties.getDispatch().getCandidateBatch()));
        for (UUID candidate : candidates) {
            Optional<JobLease> lease = claim(candidate, owner);
            if (lease.isPresent()) {
                return lease;
            }
        }
        return Optional.empty();
    }

    /**
     * Extiende el lease. {@code false} si el worker ya no es dueño del job
     * (cancelado o reencolado) y debe dejar de trabajar.
     */
    @Transactional
    public boolean renewLease(JobLease lease) {
        LocalDateTime now = now();
        return jobRepository.renewLease(lease.getJobId(), lease.getOwner(), leaseUntil(now), now,
                JobStatus.PROCESSING) == 1;
    }

    @Transactional
    public boolean recordProgress(JobLease lease, int processed, int success, int failure, String recordErrors) {
        LocalDateTime now = now();
        return jobRepository.recordProgress(lease.getJobId(), lease.getOwner(), processed, success, failure,
                recordErrors, leaseUntil(now), now, JobStatus.PROCESSING) == 1;
    }

    @Transactional
    public boolean complete(JobLease lease, int processed, int success, int failure, String recordErrors,
                            String artifactRef, String artifactContentType) {
        int updated = jobRepository.complete(lease.getJobId(), lease.getOwner(), processed, success, failure,
                recordErrors, artifactRef, artifactContentType, now(), JobStatus.PROCESSING, JobStatus.COMPLETED);
        if (updated == 0) {
            log.warn("⚠️ Job {}: resultado descartado, {} ya no tiene el lease", lease.getJobId(), lease.getOwner());
            return false;
        }
        return true;
    }

    @Transactional
    public boolean fail(JobLease lease, String errorMessage) {
        int updated = jobRepository.fail(lease.getJobId(), lease.getOwner(), errorMessage, now(),
                JobStatus.PROCESSING, JobStatus.FAILED);
        if (updated == 0) {
            log.warn("⚠️ Job {}: fallo descartado, {} ya no tiene el lease", lease.getJobId(), lease.getOwner());
            return false;
        }
        return true;
    }

    // ========== LADO CONTROLADOR ==========

    /**
     * PENDING|PROCESSING a CANCELLED. Idempotente sobre un job ya cancelado.
     */
    @Transactional
    public Job cancel(UUID jobId) {
        for (int attempt = 0; attempt < CANCEL_ATTEMPTS; attempt++) {
            Job job = get(jobId);
            if (job.getStatus() == JobStatus.CANCELLED) {
                return job;
            }
            if (job.getStatus().isTerminal()) {
                throw new InvalidJobTransitionException(jobId, job.getStatus(), "cancel");
            }
            int updated = jobRepository.cancel(jobId, job.getStatus(), "Cancelled by user", now(), JobStatus.CANCELLED);
            if (updated == 1) {
                log.info("🛑 Job {} cancelado (estaba {})", jobId, job.getStatus());
                return get(jobId);
            }
            // El estado cambió entre la lectura y el UPDATE (p.ej. PENDING -> PROCESSING): releer
        }
        Job job = get(jobId);
        if (job.getStatus() == JobStatus.CANCELLED) {
            return job;
        }
        throw new InvalidJobTransitionException(jobId, job.getStatus(), "cancel");
    }

    /**
     * FAILED|CANCELLED a PENDING. Archiva el intento anterior antes de resetear
     * la fila; si el UPDATE no gana, la transacción descarta también el archivo.
     */
    @Transactional
    public Job retry(UUID jobId) {
        Job job = get(jobId);
        if (!job.getStatus().isRetryable()) {
            throw new InvalidJobTransitionException(jobId, job.getStatus(), "retry");
        }

        LocalDateTime now = now();
        attemptRepository.save(JobAttempt.builder()
                .jobId(jobId)
                .attemptNumber(job.getRetryCount())
                .status(job.getStatus())
                .processedCount(job.getProcessedCount())
                .successCount(job.getSuccessCount())
                .failureCount(job.getFailureCount())
                .recordErrors(job.getRecordErrors())
                .errorMessage(job.getErrorMessage())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .archivedAt(now)
                .build());

        int updated = jobRepository.resetForRetry(jobId, job.getStatus(), job.getRetryCount(), now, JobStatus.PENDING);
        if (updated == 0) {
            Job current = get(jobId);
            throw new InvalidJobTransitionException(jobId, current.getStatus(), "retry");
        }
        log.info("🔁 Job {} reencolado para reintento #{}", jobId, job.getRetryCount() + 1);
        return get(jobId);
    }

    // ========== LEASE MONITOR ==========

    /**
     * Devuelve a PENDING los jobs cuyo worker dejó vencer el lease.
     */
    @Transactional
    public List<UUID> requeueExpiredLeases() {
        LocalDateTime now = now();
        List<UUID> requeued = new ArrayList<>();
        for (UUID jobId : jobRepository.findIdsWithExpiredLease(JobStatus.PROCESSING, now)) {
            if (jobRepository.requeueIfLeaseExpired(jobId, now, JobStatus.PROCESSING, JobStatus.PENDING) == 1) {
                log.warn("⏰ Lease vencido, job {} vuelve a PENDING", jobId);
                requeued.add(jobId);
            }
        }
        return requeued;
    }

    private LocalDateTime leaseUntil(LocalDateTime now) {
        return now.plus(properties.getLease().getDuration());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
