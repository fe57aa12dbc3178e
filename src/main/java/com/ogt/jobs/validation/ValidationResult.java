package com.ogt.jobs.validation;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ValidationResult {

    private ImportSchema schema;
    private int totalRows;
    private List<ImportRecord> valid;
    private List<ImportRecord> invalid;

    public int getValidCount() {
        return valid.size();
    }

    public int getInvalidCount() {
        return invalid.size();
    }

    public int getWarningCount() {
        return valid.stream().mapToInt(r -> r.getWarnings().size()).sum()
                + invalid.stream().mapToInt(r -> r.getWarnings().size()).sum();
    }

    public boolean hasValidRecords() {
        return !valid.isEmpty();
    }
}
