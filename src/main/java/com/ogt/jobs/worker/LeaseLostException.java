package com.ogt.jobs.worker;

import java.util.UUID;

/**
 * El worker ya no es dueño del job (cancelado o reencolado). Corta el
 * procesamiento sin escribir nada más.
 */
class LeaseLostException extends RuntimeException {

    LeaseLostException(UUID jobId) {
        super("Lease lost for job " + jobId + ", stopping without further writes");
    }
}
