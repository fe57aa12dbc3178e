package com.ogt.jobs.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.jobs.dto.JobActionResponse;
import com.ogt.jobs.dto.JobStatsDTO;
import com.ogt.jobs.dto.JobStatusResponse;
import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobAttempt;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.exception.BusinessException;
import com.ogt.jobs.exception.ResourceNotFoundException;
import com.ogt.jobs.repository.JobRepository;
import com.ogt.jobs.util.RecordErrorLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Lado de consulta y control: estado, cancelación, reintento, descarga y vistas de gestión.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobControlService {

    private final JobStore jobStore;
    private final JobRepository jobRepository;
    private final ArtifactStore artifactStore;
    private final JobDispatchPublisher dispatchPublisher;
    private final ObjectMapper objectMapper;

    public JobStatusResponse getStatus(UUID jobId) {
        Job job = jobStore.get(jobId);
        return toResponse(job, jobStore.attempts(jobId));
    }

    public JobActionResponse cancel(UUID jobId) {
        Job job = jobStore.cancel(jobId);
        return JobActionResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .retryCount(job.getRetryCount())
                .message(job.getErrorMessage())
                .build();
    }

    public JobActionResponse retry(UUID jobId) {
        Job job = jobStore.retry(jobId);
        dispatchPublisher.publishWakeUp(jobId);
        return JobActionResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .retryCount(job.getRetryCount())
                .message("Job queued for retry")
                .build();
    }

    public ArtifactDownload getArtifact(UUID jobId) {
        Job job = jobStore.get(jobId);
        if (job.getStatus() != JobStatus.COMPLETED || job.getArtifactRef() == null) {
            throw new ResourceNotFoundException("No artifact available for job " + jobId);
        }
        try {
            byte[] content = artifactStore.load(job.getArtifactRef());
            String ref = job.getArtifactRef();
            String fileName = ref.substring(ref.lastIndexOf('/') + 1);
            return new ArtifactDownload(fileName, job.getArtifactContentType(), content);
        } catch (IOException e) {
            log.error("❌ No se pudo leer el artefacto {} del job {}", job.getArtifactRef(), jobId, e);
            throw new ResourceNotFoundException("Artifact for job " + jobId + " is no longer available");
        }
    }

    // ========== VISTAS DE GESTIÓN ==========

    @Transactional(readOnly = true)
    public Page<JobStatusResponse> list(String scopeId, JobType type, JobStatus status, int page, int size) {
        if (page < 0 || size < 1 || size > 100) {
            throw new BusinessException("page must be >= 0 and size between 1 and 100");
        }
        Specification<Job> spec = Specification.where(null);
        if (scopeId != null && !scopeId.isBlank()) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("scopeId"), scopeId));
        }
        if (type != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("type"), type));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
        }
        Pageable pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return jobRepository.findAll(spec, pageable).map(job -> toResponse(job, List.of()));
    }

    @Transactional(readOnly = true)
    public List<JobStatusResponse> active(String scopeId) {
        List<Job> jobs = scopeId != null && !scopeId.isBlank()
                ? jobRepository.findByScopeIdAndStatusInOrderByCreatedAtDesc(scopeId, JobStatus.ACTIVE)
                : jobRepository.findByStatusInOrderByCreatedAtDesc(JobStatus.ACTIVE);
        return jobs.stream().map(job -> toResponse(job, List.of())).toList();
    }

    @Transactional(readOnly = true)
    public JobStatsDTO stats(String scopeId) {
        String scope = scopeId != null && !scopeId.isBlank() ? scopeId : null;
        JobStatsDTO stats = new JobStatsDTO();

        for (JobStatus status : JobStatus.values()) stats.getByStatus().put(status.name(), 0L);
        for (JobType type : JobType.values()) stats.getByType().put(type.name(), 0L);

        long total = 0;
        for (Object[] row : jobRepository.countByStatus(scope)) {
            long count = ((Number) row[1]).longValue();
            stats.getByStatus().put(((JobStatus) row[0]).name(), count);
            total += count;
        }
        for (Object[] row : jobRepository.countByType(scope)) {
            stats.getByType().put(((JobType) row[0]).name(), ((Number) row[1]).longValue());
        }
        stats.setTotal(total);

        List<Job> recent = scope != null
                ? jobRepository.findTop5ByScopeIdOrderByCreatedAtDesc(scope)
                : jobRepository.findTop5ByOrderByCreatedAtDesc();
        stats.setRecent(recent.stream().map(job -> toResponse(job, List.of())).toList());
        return stats;
    }

    // ========== MAPEO ==========

    JobStatusResponse toResponse(Job job, List<JobAttempt> attempts) {
        JobStatusResponse.Result result = null;
        if (job.getStatus() != JobStatus.PENDING) {
            result = JobStatusResponse.Result.builder()
                    .successCount(job.getSuccessCount())
                    .failureCount(job.getFailureCount())
                    .recordErrors(RecordErrorLog.fromJson(objectMapper, job.getRecordErrors()))
                    .build();
        }

        List<JobStatusResponse.Attempt> history = new ArrayList<>();
        for (JobAttempt attempt : attempts) {
            history.add(JobStatusResponse.Attempt.builder()
                    .attemptNumber(attempt.getAttemptNumber())
                    .status(attempt.getStatus())
                    .processedCount(attempt.getProcessedCount())
                    .successCount(attempt.getSuccessCount())
                    .failureCount(attempt.getFailureCount())
                    .errorMessage(attempt.getErrorMessage())
                    .startedAt(attempt.getStartedAt())
                    .completedAt(attempt.getCompletedAt())
                    .build());
        }

        return JobStatusResponse.builder()
                .jobId(job.getId())
                .type(job.getType())
                .scopeId(job.getScopeId())
                .status(job.getStatus())
                .progress(JobStatusResponse.Progress.of(job.getProcessedCount(), job.getTotalCount()))
                .result(result)
                .errorMessage(job.getErrorMessage())
                .retryCount(job.getRetryCount())
                .priority(job.getPriority())
                .fileName(job.getFileName())
                .createdBy(job.getCreatedBy())
                .artifactAvailable(job.getStatus() == JobStatus.COMPLETED && job.getArtifactRef() != null)
                .attempts(history)
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
