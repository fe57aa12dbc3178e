package com.ogt.jobs.exception;

/**
 * Fallo sistémico del worker: el job pasa a FAILED con este mensaje.
 */
public class JobProcessingException extends RuntimeException {

    public JobProcessingException(String message) {
        super(message);
    }

    public JobProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
