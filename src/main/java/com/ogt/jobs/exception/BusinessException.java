package com.ogt.jobs.exception;

/**
 * Error de negocio o de entrada: la operación no se realiza y nada queda persistido.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
