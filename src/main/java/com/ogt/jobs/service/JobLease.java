package com.ogt.jobs.service;

import com.ogt.jobs.config.WorkerIdentity;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.UUID;

/**
 * Prueba de que un worker ganó el claim de un job. Toda escritura del worker
 * la presenta y sólo prospera mientras el lease siga siendo suyo.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class JobLease {

    private final UUID jobId;
    private final String owner;

    public String getAttemptTag() {
        return WorkerIdentity.attemptTag(owner);
    }
}
