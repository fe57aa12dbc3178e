package com.ogt.jobs.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.jobs.entity.ImportedRecord;
import com.ogt.jobs.exception.JobProcessingException;
import com.ogt.jobs.repository.ImportedRecordRepository;
import com.ogt.jobs.validation.ImportSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fase 1 del reporte: filas de la institución del job para el tipo pedido.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportDataSource {

    private static final TypeReference<LinkedHashMap<String, String>> FIELDS_TYPE = new TypeReference<>() {};

    private final ImportedRecordRepository recordRepository;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public List<Map<String, String>> fetch(String scopeId, ImportSchema reportType) {
        List<ImportedRecord> records =
                recordRepository.findByScopeIdAndRecordTypeOrderByCreatedAtAsc(scopeId, reportType.getRecordType());

        List<Map<String, String>> rows = new ArrayList<>(records.size());
        for (ImportedRecord record : records) {
            try {
                rows.add(objectMapper.readValue(record.getFields(), FIELDS_TYPE));
            } catch (JsonProcessingException e) {
                throw new JobProcessingException("Unreadable stored record " + record.getId(), e);
            }
        }
        log.debug("📄 {} filas de {} para scope {}", rows.size(), reportType, scopeId);
        return rows;
    }
}
