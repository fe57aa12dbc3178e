package com.ogt.jobs.service;

import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.repository.JobAttemptRepository;
import com.ogt.jobs.repository.JobPayloadRepository;
import com.ogt.jobs.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Limpieza diaria de jobs terminados hace más de {@code jobs.retention.days}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRetentionService {

    private final JobRepository jobRepository;
    private final JobAttemptRepository attemptRepository;
    private final JobPayloadRepository payloadRepository;
    private final ArtifactStore artifactStore;
    private final JobProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${jobs.retention.cron:0 0 3 * * *}")
    public void scheduledPurge() {
        purgeExpired();
    }

    @Transactional
    public int purgeExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(properties.getRetention().getDays());
        List<Job> expired = jobRepository.findByStatusInAndCompletedAtBefore(JobStatus.TERMINAL, cutoff);

        for (Job job : expired) {
            if (job.getArtifactRef() != null) {
                try {
                    artifactStore.delete(job.getArtifactRef());
                } catch (IOException e) {
                    log.warn("⚠️ No se pudo borrar el artefacto {} del job {}: {}",
                            job.getArtifactRef(), job.getId(), e.getMessage());
                }
            }
            attemptRepository.deleteByJobId(job.getId());
            if (job.getPayloadRef() != null) {
                payloadRepository.deleteById(UUID.fromString(job.getPayloadRef()));
            }
            jobRepository.delete(job);
        }

        if (!expired.isEmpty()) {
            log.info("🧹 {} jobs terminados antes de {} eliminados", expired.size(), cutoff);
        }
        return expired.size();
    }
}
