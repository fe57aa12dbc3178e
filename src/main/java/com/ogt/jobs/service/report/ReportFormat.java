package com.ogt.jobs.service.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportFormat {

    EXCEL("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
    CSV("csv", "text/csv"),
    PDF("pdf", "application/pdf"),
    JSON("json", "application/json");

    private final String extension;
    private final String contentType;

    ReportFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String getExtension() {
        return extension;
    }

    public String getContentType() {
        return contentType;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ReportFormat fromValue(String value) {
        if (value == null) return null;
        for (ReportFormat format : values()) {
            if (format.name().equalsIgnoreCase(value.trim())) return format;
        }
        throw new IllegalArgumentException("Unsupported export format: " + value + " (use excel, csv, pdf or json)");
    }
}
