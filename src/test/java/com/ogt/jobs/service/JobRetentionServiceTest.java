package com.ogt.jobs.service;

import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.repository.JobAttemptRepository;
import com.ogt.jobs.repository.JobPayloadRepository;
import com.ogt.jobs.repository.JobRepository;
import com.ogt.jobs.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobRetentionServiceTest {

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobAttemptRepository attemptRepository;

    @Mock
    private JobPayloadRepository payloadRepository;

    @Mock
    private ArtifactStore artifactStore;

    private JobRetentionService retentionService;

    @BeforeEach
    void setUp() {
        JobProperties properties = new JobProperties();
        properties.getRetention().setDays(30);
        MutableClock clock = new MutableClock(Instant.parse("2026-03-31T12:00:00Z"));
        retentionService = new JobRetentionService(jobRepository, attemptRepository, payloadRepository,
                artifactStore, properties, clock);
    }

    @Test
    void looksOnlyForTerminalJobsOlderThanTheCutoff() {
        when(jobRepository.findByStatusInAndCompletedAtBefore(JobStatus.TERMINAL,
                LocalDateTime.of(2026, 3, 1, 12, 0))).thenReturn(List.of());

        assertThat(retentionService.purgeExpired()).isZero();

        verify(jobRepository, never()).delete(any(Job.class));
    }

    @Test
    void removesArtifactAttemptsPayloadAndJob() throws IOException {
        UUID payloadId = UUID.randomUUID();
        Job report = job(JobType.GENERATE_REPORT, payloadId, "abc/report-abc-1.json");
        when(jobRepository.findByStatusInAndCompletedAtBefore(any(), any())).thenReturn(List.of(report));

        assertThat(retentionService.purgeExpired()).isEqualTo(1);

        verify(artifactStore).delete("abc/report-abc-1.json");
        verify(attemptRepository).deleteByJobId(report.getId());
        verify(payloadRepository).deleteById(payloadId);
        verify(jobRepository).delete(report);
    }

    @Test
    void missingArtifactDoesNotStopThePurge() throws IOException {
        Job report = job(JobType.GENERATE_REPORT, UUID.randomUUID(), "gone/report.json");
        Job importJob = job(JobType.IMPORT_STAFF, UUID.randomUUID(), null);
        when(jobRepository.findByStatusInAndCompletedAtBefore(any(), any())).thenReturn(List.of(report, importJob));
        doThrow(new IOException("disk unavailable")).when(artifactStore).delete("gone/report.json");

        assertThat(retentionService.purgeExpired()).isEqualTo(2);

        verify(jobRepository).delete(report);
        verify(jobRepository).delete(importJob);
    }

    private Job job(JobType type, UUID payloadId, String artifactRef) {
        return Job.builder()
                .id(UUID.randomUUID())
                .type(type)
                .scopeId("inst-1")
                .status(JobStatus.COMPLETED)
                .payloadRef(payloadId.toString())
                .artifactRef(artifactRef)
                .completedAt(LocalDateTime.of(2026, 1, 10, 9, 0))
                .build();
    }
}
