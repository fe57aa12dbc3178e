package com.ogt.jobs.repository;

import com.ogt.jobs.entity.ImportedRecord;
import com.ogt.jobs.validation.RecordType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ImportedRecordRepository extends JpaRepository<ImportedRecord, UUID> {

    boolean existsByScopeIdAndRecordTypeAndIdentifier(String scopeId, RecordType recordType, String identifier);

    Optional<ImportedRecord> findByScopeIdAndRecordTypeAndIdentifier(String scopeId, RecordType recordType,
                                                                     String identifier);

    // Lectura de reportes: siempre acotada a una institución
    List<ImportedRecord> findByScopeIdAndRecordTypeOrderByCreatedAtAsc(String scopeId, RecordType recordType);

    long countByJobId(UUID jobId);
}
