package com.ogt.jobs.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "job_payloads")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class JobPayload {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, length = 40)
    private JobType jobType;

    @Lob
    @Column(nullable = false)
    private String content; // registros validados o ReportConfig, en JSON

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
