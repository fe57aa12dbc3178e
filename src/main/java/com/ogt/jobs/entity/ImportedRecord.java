package com.ogt.jobs.entity;

import com.ogt.jobs.validation.RecordType;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Registro escrito por un job de importación. La unicidad por institución
 * y tipo es la restricción que produce los fallos por registro.
 */
@Entity
@Table(name = "imported_records",
        uniqueConstraints = @UniqueConstraint(name = "uq_imported_records_identifier",
                columnNames = {"scope_id", "record_type", "identifier"}))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ImportedRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "scope_id", nullable = false, length = 100)
    private String scopeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_type", nullable = false, length = 30)
    private RecordType recordType;

    @Column(nullable = false, length = 200)
    private String identifier;

    @Lob
    @Column(nullable = false)
    private String fields; // JSON con la fila original

    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
