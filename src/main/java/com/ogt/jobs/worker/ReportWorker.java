package com.ogt.jobs.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.jobs.dto.ReportConfig;
import com.ogt.jobs.entity.Job;
import com.ogt.jobs.entity.JobPayload;
import com.ogt.jobs.exception.JobProcessingException;
import com.ogt.jobs.repository.JobPayloadRepository;
import com.ogt.jobs.service.ArtifactStore;
import com.ogt.jobs.service.JobLease;
import com.ogt.jobs.service.JobStore;
import com.ogt.jobs.service.report.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Genera un reporte en tres fases (consulta, armado, exportación). Entre fases
 * se renueva el lease y se detecta una cancelación.
 */
@Slf4j
@Component
public class ReportWorker {

    public static final int PHASES = 3;

    private final JobStore jobStore;
    private final JobPayloadRepository payloadRepository;
    private final ReportDataSource dataSource;
    private final ReportAssembler assembler;
    private final ArtifactStore artifactStore;
    private final ObjectMapper objectMapper;
    private final Map<ReportFormat, ReportExporter> exporters = new EnumMap<>(ReportFormat.class);

    public ReportWorker(JobStore jobStore,
                        JobPayloadRepository payloadRepository,
                        ReportDataSource dataSource,
                        ReportAssembler assembler,
                        ArtifactStore artifactStore,
                        ObjectMapper objectMapper,
                        List<ReportExporter> exporters) {
        this.jobStore = jobStore;
        this.payloadRepository = payloadRepository;
        this.dataSource = dataSource;
        this.assembler = assembler;
        this.artifactStore = artifactStore;
        this.objectMapper = objectMapper;
        exporters.forEach(exporter -> this.exporters.put(exporter.getFormat(), exporter));
    }

    public void process(Job job, JobLease lease) throws IOException {
        if (job.getScopeId() == null || job.getScopeId().isBlank()) {
            throw new JobProcessingException("Job has no scope");
        }
        ReportConfig config = loadConfig(job);
        ReportExporter exporter = exporters.get(config.getExportFormat());
        if (exporter == null) {
            throw new JobProcessingException("Unsupported export format: " + config.getExportFormat());
        }

        // 1. Consulta acotada a la institución del job
        List<Map<String, String>> rows = dataSource.fetch(job.getScopeId(), config.getReportType());
        checkpoint(lease, 1);

        // 2. Armado: filtros, columnas, orden y grupos
        ReportTable table = assembler.assemble(rows, config);
        if (table.isEmpty()) {
            throw new JobProcessingException("No data found for the given filters");
        }
        checkpoint(lease, 2);

        // 3. Exportación; el artefacto sólo queda visible cuando el job pasa a COMPLETED
        byte[] content = exporter.export(table);
        // La exportación puede ser larga: se renueva antes de publicar el archivo
        if (!jobStore.renewLease(lease)) {
            throw new LeaseLostException(job.getId());
        }
        // Un nombre por lease: un worker que perdió el job nunca pisa ni borra el archivo de otro
        String fileName = "report-" + job.getId() + "-" + lease.getAttemptTag() + "."
                + config.getExportFormat().getExtension();
        String artifactRef = artifactStore.store(job.getId(), fileName, content);

        if (jobStore.complete(lease, PHASES, PHASES, 0, null, artifactRef, config.getExportFormat().getContentType())) {
            log.info("✅ Reporte {} completado: {} filas en {}", job.getId(), table.getRowCount(), fileName);
        } else {
            // Cancelado o reencolado durante la exportación: el archivo no se publica
            artifactStore.delete(artifactRef);
        }
    }

    private void checkpoint(JobLease lease, int phase) {
        if (!jobStore.recordProgress(lease, phase, phase, 0, null)) {
            throw new LeaseLostException(lease.getJobId());
        }
    }

    private ReportConfig loadConfig(Job job) {
        JobPayload payload = payloadRepository.findById(UUID.fromString(job.getPayloadRef()))
                .orElseThrow(() -> new JobProcessingException("Job payload not found: " + job.getPayloadRef()));
        try {
            return objectMapper.readValue(payload.getContent(), ReportConfig.class);
        } catch (JsonProcessingException e) {
            throw new JobProcessingException("Unable to read report configuration: " + e.getOriginalMessage(), e);
        }
    }
}
