package com.ogt.jobs.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionOptions {

    private Integer priority;

    // null equivale a asíncrono
    private Boolean async;

    private String fileName;
    private String createdBy;

    public boolean isSyncRequested() {
        return Boolean.FALSE.equals(async);
    }

    public static SubmissionOptions defaults() {
        return new SubmissionOptions();
    }
}
