package com.ogt.jobs.dto;

import com.ogt.jobs.service.report.ReportFormat;
import com.ogt.jobs.validation.ImportSchema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuración de un reporte. Se guarda tal cual como payload del job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportConfig {

    @NotNull(message = "reportType is required")
    private ImportSchema reportType;

    @Builder.Default
    @Size(max = 100, message = "At most 100 columns are allowed")
    private List<@Size(max = 100, message = "Column names must be at most 100 characters") String> columns = new ArrayList<>();

    // Valor simple o lista de valores; igualdad sin distinguir mayúsculas
    @Builder.Default
    private Map<@Pattern(regexp = "^[a-zA-Z][a-zA-Z0-9_-]{0,49}$", message = "Invalid filter key") String, Object> filters =
            new LinkedHashMap<>();

    @Size(max = 100)
    private String groupBy;

    @Size(max = 100)
    private String sortBy;

    @Pattern(regexp = "(?i)asc|desc", message = "sortOrder must be asc or desc")
    private String sortOrder;

    @NotNull(message = "exportFormat is required")
    private ReportFormat exportFormat;

    @Size(max = 200)
    private String title;

    public boolean isDescending() {
        return "desc".equalsIgnoreCase(sortOrder);
    }
}
