package com.ogt.jobs.dto;

import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.validation.ImportRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Resultado de la validación en seco de una planilla: no crea ningún job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationPreviewResponse {

    private String fileName;
    private JobType type;
    private int totalRows;
    private int validCount;
    private int invalidCount;
    private int warningCount;

    @Builder.Default
    private List<ImportRecord> validRecords = new ArrayList<>();

    @Builder.Default
    private List<ImportRecord> invalidRecords = new ArrayList<>();
}
