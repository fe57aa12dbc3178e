package com.ogt.jobs.exception;

/**
 * Fallo de un único registro durante la importación. Se anota en el resultado
 * del job y el worker sigue con el siguiente registro.
 */
public class RecordRejectedException extends RuntimeException {

    public RecordRejectedException(String message) {
        super(message);
    }
}
