package com.ogt.jobs.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.config.WorkerIdentity;
import com.ogt.jobs.dto.JobSubmissionResponse;
import com.ogt.jobs.dto.ReportConfig;
import com.ogt.jobs.dto.SubmitJobRequest;
import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobPayload;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.exception.BusinessException;
import com.ogt.jobs.repository.JobPayloadRepository;
import com.ogt.jobs.validation.*;
import com.ogt.jobs.worker.JobWorker;
import com.ogt.jobs.worker.ReportWorker;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Alta de jobs. Valida, guarda el payload y la fila PENDING, y despierta a los
 * workers. Con {@code async=false} y un lote chico procesa el job en el hilo
 * del llamador usando el mismo claim que los workers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSubmissionService {

    private final JobStore jobStore;
    private final JobPayloadRepository payloadRepository;
    private final RecordValidator recordValidator;
    private final JobDispatchPublisher dispatchPublisher;
    private final JobControlService controlService;
    private final JobWorker jobWorker;
    private final WorkerIdentity workerIdentity;
    private final JobProperties properties;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final Clock clock;

    /**
     * Alta genérica de {@code POST /api/jobs}.
     */
    public JobSubmissionResponse submit(SubmitJobRequest request) {
        SubmissionOptions options = SubmissionOptions.builder()
                .priority(request.getPriority())
                .async(request.getAsync())
                .createdBy(request.getCreatedBy())
                .build();

        if (request.getType() == JobType.GENERATE_REPORT) {
            return submitReport(request.getScopeId(), toReportConfig(request.getPayload()), options);
        }

        ImportSchema schema = request.getType().getSchema();
        ValidationResult validation = recordValidator.validate(schema, toRawRows(schema, request.getPayload()));
        return submitImport(request.getType(), request.getScopeId(), validation, options);
    }

    // ========== IMPORTACIÓN ==========

    public JobSubmissionResponse submitImport(JobType type, String scopeId, ValidationResult validation,
                                              SubmissionOptions options) {
        if (type == null || !type.isImport()) {
            throw new BusinessException("Job type " + type + " is not an import type");
        }
        requireScope(scopeId);
        if (!validation.hasValidRecords()) {
            throw new BusinessException("No valid records to import: " + validation.getInvalidCount()
                    + " of " + validation.getTotalRows() + " rows rejected");
        }

        List<ImportRecord> valid = validation.getValid();
        Job job = enqueue(type, scopeId, writeJson(valid), valid.size(), options);

        JobSubmissionResponse response = JobSubmissionResponse.builder()
                .jobId(job.getId())
                .type(type)
                .status(job.getStatus())
                .totalCount(job.getTotalCount())
                .validCount(validation.getValidCount())
                .invalidCount(validation.getInvalidCount())
                .warningCount(validation.getWarningCount())
                .rejectedRecords(validation.getInvalid())
                .recordsWithWarnings(valid.stream().filter(r -> !r.getWarnings().isEmpty()).toList())
                .message(validation.getInvalidCount() > 0
                        ? validation.getInvalidCount() + " rows rejected by validation were not queued"
                        : null)
                .build();

        return dispatch(job, valid.size(), options, response);
    }

    // ========== REPORTES ==========

    public JobSubmissionResponse submitReport(String scopeId, ReportConfig config, SubmissionOptions options) {
        requireScope(scopeId);
        validateReportConfig(config);

        Job job = enqueue(JobType.GENERATE_REPORT, scopeId, writeJson(config), ReportWorker.PHASES, options);

        JobSubmissionResponse response = JobSubmissionResponse.builder()
                .jobId(job.getId())
                .type(JobType.GENERATE_REPORT)
                .status(job.getStatus())
                .totalCount(job.getTotalCount())
                .build();

        return dispatch(job, ReportWorker.PHASES, options, response);
    }

    // ========== INTERNOS ==========

    private Job enqueue(JobType type, String scopeId, String payloadContent, int total, SubmissionOptions options) {
        JobPayload payload = payloadRepository.save(JobPayload.builder()
                .jobType(type)
                .content(payloadContent)
                .createdAt(LocalDateTime.now(clock))
                .build());

        Job job = jobStore.create(Job.builder()
                .type(type)
                .scopeId(scopeId)
                .payloadRef(payload.getId().toString())
                .totalCount(total)
                .priority(options.getPriority() != null ? options.getPriority() : 5)
                .fileName(options.getFileName())
                .createdBy(options.getCreatedBy())
                .build());

        log.info("🚀 Job {} ({}) encolado para scope {} con {} elementos", job.getId(), type, scopeId, total);
        return job;
    }

    private JobSubmissionResponse dispatch(Job job, int size, SubmissionOptions options,
                                           JobSubmissionResponse response) {
        if (options.isSyncRequested() && size <= properties.getSync().getMaxRows()) {
            Optional<JobLease> lease = jobStore.claim(job.getId(), workerIdentity.newLeaseOwner());
            if (lease.isPresent()) {
                log.info("▶️ Job {} procesado en modo síncrono", job.getId());
                jobWorker.execute(lease.get());
            }
            response.setJob(controlService.getStatus(job.getId()));
            response.setStatus(response.getJob().getStatus());
            return response;
        }

        // La fila ya está confirmada: el aviso nunca llega antes que el job
        dispatchPublisher.publishWakeUp(job.getId());
        return response;
    }

    List<RawRow> toRawRows(ImportSchema schema, JsonNode payload) {
        if (payload == null || !payload.isArray()) {
            throw new BusinessException("Import payload must be a list of rows");
        }
        List<RawRow> rows = new ArrayList<>();
        int index = 0;
        for (JsonNode element : payload) {
            if (!element.isObject()) {
                throw new BusinessException("Row " + (index + 1) + " of the payload is not an object");
            }
            // {rowNumber, fields} o un objeto plano; sin número se asume una planilla con encabezado
            int rowNumber = index + 2;
            JsonNode fieldsNode = element;
            if (element.path("fields").isObject()) {
                fieldsNode = element.get("fields");
                if (element.path("rowNumber").isInt()) rowNumber = element.get("rowNumber").asInt();
            }

            Map<String, String> raw = new LinkedHashMap<>();
            fieldsNode.fields().forEachRemaining(entry -> raw.put(entry.getKey(), asText(entry.getValue())));
            rows.add(new RawRow(rowNumber, schema.canonicalize(raw)));
            index++;
        }
        return rows;
    }

    private ReportConfig toReportConfig(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new BusinessException("Report payload must be a report configuration object");
        }
        try {
            return objectMapper.treeToValue(payload, ReportConfig.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new BusinessException("Invalid report configuration: " + e.getMessage(), e);
        }
    }

    private void validateReportConfig(ReportConfig config) {
        if (config == null) {
            throw new BusinessException("Report configuration is required");
        }
        Set<ConstraintViolation<ReportConfig>> violations = validator.validate(config);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new BusinessException("Invalid report configuration: " + details);
        }
    }

    private static void requireScope(String scopeId) {
        if (scopeId == null || scopeId.isBlank()) {
            throw new BusinessException("scopeId is required");
        }
    }

    private static String asText(JsonNode value) {
        if (value == null || value.isNull()) return null;
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize job payload", e);
        }
    }
}
