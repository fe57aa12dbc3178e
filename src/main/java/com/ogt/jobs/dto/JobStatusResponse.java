package com.ogt.jobs.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.util.RecordErrorLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Vista de un job para polling. En estados terminales es siempre la misma.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private UUID jobId;
    private JobType type;
    private String scopeId;
    private JobStatus status;
    private Progress progress;
    private Result result;
    private String errorMessage;
    private int retryCount;
    private int priority;
    private String fileName;
    private String createdBy;
    private boolean artifactAvailable;

    @Builder.Default
    private List<Attempt> attempts = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public int getProcessedCount() {
        return progress != null ? progress.getProcessed() : 0;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Progress {
        private int processed;
        private int total;
        private int percentage;

        public static Progress of(int processed, int total) {
            int percentage = total > 0 ? (int) Math.min(100, Math.round(processed * 100.0 / total)) : 0;
            return new Progress(processed, total, percentage);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Result {
        private int successCount;
        private int failureCount;

        @Builder.Default
        private List<RecordErrorLog.RecordError> recordErrors = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attempt {
        private int attemptNumber;
        private JobStatus status;
        private int processedCount;
        private int successCount;
        private int failureCount;
        private String errorMessage;
        private LocalDateTime startedAt;
        private LocalDateTime completedAt;
    }
}
