package com.ogt.jobs.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.ogt.jobs.entity.JobType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Alta genérica. {@code payload} es una lista de filas para los tipos de
 * importación o un {@link ReportConfig} para GENERATE_REPORT.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitJobRequest {

    @NotNull(message = "type is required")
    private JobType type;

    @NotBlank(message = "scopeId is required")
    @Size(max = 100)
    private String scopeId;

    @NotNull(message = "payload is required")
    private JsonNode payload;

    @Min(0) @Max(100)
    private Integer priority;

    private Boolean async;

    @Size(max = 100)
    private String createdBy;
}
