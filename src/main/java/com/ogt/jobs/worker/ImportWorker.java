package com.ogt.jobs.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobPayload;
import com.ogt.jobs.exception.JobProcessingException;
import com.ogt.jobs.exception.RecordRejectedException;
import com.ogt.jobs.repository.JobPayloadRepository;
import com.ogt.jobs.service.ImportRecordWriter;
import com.ogt.jobs.service.JobLease;
import com.ogt.jobs.service.JobStore;
import com.ogt.jobs.util.RecordErrorLog;
import com.ogt.jobs.validation.ImportRecord;
import com.ogt.jobs.validation.RecordType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Escribe los registros validados de un job de importación, uno por uno.
 * Un registro que falla se anota y no detiene el resto.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportWorker {

    private static final TypeReference<List<ImportRecord>> RECORDS_TYPE = new TypeReference<>() {};

    private final JobStore jobStore;
    private final JobPayloadRepository payloadRepository;
    private final ImportRecordWriter recordWriter;
    private final JobProperties properties;
    private final ObjectMapper objectMapper;

    public void process(Job job, JobLease lease) {
        if (job.getScopeId() == null || job.getScopeId().isBlank()) {
            throw new JobProcessingException("Job has no scope");
        }
        RecordType recordType = job.getType().getSchema().getRecordType();
        List<ImportRecord> records = loadRecords(job);

        int flushEvery = Math.max(1, properties.getWorker().getProgressFlushEvery());
        int processed = 0;
        int success = 0;
        int failure = 0;
        RecordErrorLog errorLog = new RecordErrorLog();

        for (ImportRecord record : records) {
            try {
                recordWriter.write(job.getId(), job.getScopeId(), recordType, record);
                success++;
            } catch (RecordRejectedException | DataIntegrityViolationException e) {
                failure++;
                errorLog.addError(record.getRowNumber(), record.getIdentifier(), e.getMessage());
                log.warn("⚠️ Job {} fila {}: {}", job.getId(), record.getRowNumber(), e.getMessage());
            }
            processed++;
            if (processed == records.size()) break;

            // Entre registros se renueva el lease: es el punto de cancelación cooperativa.
            // El progreso sólo se escribe cada flushEvery registros.
            boolean stillOwned = processed % flushEvery == 0
                    ? jobStore.recordProgress(lease, processed, success, failure, errorLog.toJson(objectMapper))
                    : jobStore.renewLease(lease);
            if (!stillOwned) {
                throw new LeaseLostException(job.getId());
            }
        }

        if (jobStore.complete(lease, processed, success, failure, errorLog.toJson(objectMapper), null, null)) {
            log.info("✅ Importación {} completada: {} OK, {} con error de {}",
                    job.getId(), success, failure, processed);
            if (errorLog.hasErrors()) {
                log.info(errorLog.getSummary());
            }
        }
    }

    private List<ImportRecord> loadRecords(Job job) {
        JobPayload payload = payloadRepository.findById(UUID.fromString(job.getPayloadRef()))
                .orElseThrow(() -> new JobProcessingException("Job payload not found: " + job.getPayloadRef()));
        try {
            return objectMapper.readValue(payload.getContent(), RECORDS_TYPE);
        } catch (JsonProcessingException e) {
            throw new JobProcessingException("Unable to read job payload: " + e.getOriginalMessage(), e);
        }
    }
}
