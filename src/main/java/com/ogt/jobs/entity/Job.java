package com.ogt.jobs.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Fila durable de un job. Es la cola y la única fuente de verdad del estado:
 * toda transición pasa por un UPDATE condicional de {@code JobRepository}.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "ix_jobs_status_priority", columnList = "status, priority, created_at"),
        @Index(name = "ix_jobs_scope", columnList = "scope_id")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 40)
    private JobType type;

    @Column(name = "scope_id", nullable = false, length = 100)
    private String scopeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "payload_ref", nullable = false, length = 100)
    private String payloadRef;

    // Denominador fijo desde el alta, nunca se modifica
    @Column(name = "total_count", nullable = false, updatable = false)
    private int totalCount;

    @Builder.Default
    @Column(name = "processed_count", nullable = false)
    private int processedCount = 0;

    @Builder.Default
    @Column(name = "success_count", nullable = false)
    private int successCount = 0;

    @Builder.Default
    @Column(name = "failure_count", nullable = false)
    private int failureCount = 0;

    @Lob
    @Column(name = "record_errors")
    private String recordErrors; // JSON: [{rowNumber, identifier, errors[]}]

    @Builder.Default
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Builder.Default
    @Column(nullable = false)
    private int priority = 5;

    @Column(name = "lease_owner", length = 200)
    private String leaseOwner;

    @Column(name = "lease_expires_at")
    private LocalDateTime leaseExpiresAt;

    @Column(name = "artifact_ref", length = 1000)
    private String artifactRef;

    @Column(name = "artifact_content_type", length = 200)
    private String artifactContentType;

    @Column(name = "file_name")
    private String fileName;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Lob
    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
