package com.ogt.jobs.exception;

import com.ogt.jobs.entity.JobStatus;
import lombok.Getter;

import java.util.UUID;

@Getter
public class InvalidJobTransitionException extends RuntimeException {

    private final UUID jobId;
    private final JobStatus currentStatus;

    public InvalidJobTransitionException(UUID jobId, JobStatus currentStatus, String action) {
        super("Invalid transition: cannot " + action + " job " + jobId + " in status " + currentStatus);
        this.jobId = jobId;
        this.currentStatus = currentStatus;
    }
}
