package com.ogt.jobs.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Resultado archivado de un intento anterior. Se escribe al reintentar,
 * antes de resetear la fila del job.
 */
@Entity
@Table(name = "job_attempts", indexes = @Index(name = "ix_job_attempts_job", columnList = "job_id"))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class JobAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "processed_count")
    private int processedCount;

    @Column(name = "success_count")
    private int successCount;

    @Column(name = "failure_count")
    private int failureCount;

    @Lob
    @Column(name = "record_errors")
    private String recordErrors;

    @Lob
    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "archived_at", nullable = false)
    private LocalDateTime archivedAt;
}
