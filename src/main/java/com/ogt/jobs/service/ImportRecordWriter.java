package com.ogt.jobs.service;

import com.ogt.jobs.validation.ImportRecord;
import com.ogt.jobs.validation.RecordType;

import java.util.UUID;

/**
 * Destino de los registros importados.
 * Lanza {@link com.ogt.jobs.exception.RecordRejectedException} cuando el registro
 * no puede escribirse; el worker lo cuenta como fallo de esa fila y sigue.
 */
public interface ImportRecordWriter {

    void write(UUID jobId, String scopeId, RecordType recordType, ImportRecord record);
}
