package com.ogt.jobs.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.jobs.entity.ImportedRecord;
import com.ogt.jobs.exception.RecordRejectedException;
import com.ogt.jobs.repository.ImportedRecordRepository;
import com.ogt.jobs.validation.ImportRecord;
import com.ogt.jobs.validation.ImportSchema;
import com.ogt.jobs.validation.RecordType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaImportRecordWriter implements ImportRecordWriter {

    private final ImportedRecordRepository recordRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public void write(UUID jobId, String scopeId, RecordType recordType, ImportRecord record) {
        Map<String, String> fields = new LinkedHashMap<>(record.getFields());

        // Nunca se escribe fuera de la institución del job
        String rowScope = fields.remove(ImportSchema.SCOPE_FIELD);
        if (rowScope != null && !rowScope.equals(scopeId)) {
            throw new RecordRejectedException("Record belongs to a different scope: " + rowScope);
        }

        Optional<ImportedRecord> existing =
                recordRepository.findByScopeIdAndRecordTypeAndIdentifier(scopeId, recordType, record.getIdentifier());
        if (existing.isPresent()) {
            // Escrito por un intento anterior de este mismo job (lease vencido o reintento): ya está importado
            if (jobId.equals(existing.get().getJobId())) {
                log.debug("Fila {} del job {} ya escrita por un intento previo", record.getRowNumber(), jobId);
                return;
            }
            throw new RecordRejectedException(label(recordType) + " with identifier "
                    + record.getIdentifier() + " already exists");
        }

        try {
            recordRepository.saveAndFlush(ImportedRecord.builder()
                    .scopeId(scopeId)
                    .recordType(recordType)
                    .identifier(record.getIdentifier())
                    .fields(objectMapper.writeValueAsString(fields))
                    .jobId(jobId)
                    .createdAt(LocalDateTime.now(clock))
                    .build());
        } catch (DataIntegrityViolationException e) {
            // Otro job insertó el mismo identificador entre la búsqueda y el insert
            log.debug("Violación de unicidad en fila {}: {}", record.getRowNumber(), e.getMessage());
            throw new RecordRejectedException(label(recordType) + " with identifier "
                    + record.getIdentifier() + " already exists");
        } catch (JsonProcessingException e) {
            throw new RecordRejectedException("Unable to serialize record: " + e.getOriginalMessage());
        }
    }

    private static String label(RecordType recordType) {
        return switch (recordType) {
            case STUDENT -> "Student";
            case STAFF -> "Staff member";
            case SELF_INTERNSHIP -> "Internship";
        };
    }
}
