package com.ogt.jobs.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ogt.jobs.entity.JobStatus;
import com.ogt.jobs.entity.JobType;
import com.ogt.jobs.validation.ImportRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobSubmissionResponse {

    private UUID jobId;
    private JobType type;
    private JobStatus status;
    private int totalCount;

    // Resumen de validación (sólo importaciones)
    private Integer validCount;
    private Integer invalidCount;
    private Integer warningCount;

    @Builder.Default
    private List<ImportRecord> rejectedRecords = new ArrayList<>();

    @Builder.Default
    private List<ImportRecord> recordsWithWarnings = new ArrayList<>();

    // Vista final cuando el job corrió en modo síncrono
    private JobStatusResponse job;

    private String message;
}
