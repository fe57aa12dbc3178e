package com.ogt.jobs.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.UUID;

/**
 * Identidad de este proceso. Cada claim recibe un owner propio para que dos
 * hilos del mismo proceso nunca compartan lease.
 */
@Getter
@RequiredArgsConstructor
public class WorkerIdentity {

    public static final String OWNER_SEPARATOR = ":";

    private final String id;

    public String newLeaseOwner() {
        return id + OWNER_SEPARATOR + UUID.randomUUID().toString().substring(0, 8);
    }

    /** Sufijo propio de cada claim, o el owner completo si no lleva separador. */
    public static String attemptTag(String owner) {
        return owner.substring(owner.lastIndexOf(OWNER_SEPARATOR) + 1);
    }
}
