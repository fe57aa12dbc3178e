package com.ogt.jobs.dto;

import com.ogt.jobs.entity.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobActionResponse {

    private UUID jobId;
    private JobStatus status;
    private int retryCount;
    private String message;
}
