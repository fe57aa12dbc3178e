package com.ogt.jobs.support;

import com.ogt.jobs.service.ImportRecordWriter;
import com.ogt.jobs.service.JpaImportRecordWriter;
import com.ogt.jobs.validation.ImportRecord;
import com.ogt.jobs.validation.RecordType;
import lombok.RequiredArgsConstructor;
import lombok.Setter;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Escritor real con un gancho tras cada escritura confirmada. Permite simular
 * cancelaciones, relojes que avanzan o leases que vencen entre registros.
 */
@RequiredArgsConstructor
public class HookedRecordWriter implements ImportRecordWriter {

    private final JpaImportRecordWriter delegate;
    private final AtomicInteger writes = new AtomicInteger();

    // Recibe el número de escrituras hechas hasta el momento
    @Setter
    private IntConsumer afterWrite = n -> { };

    @Override
    public void write(UUID jobId, String scopeId, RecordType recordType, ImportRecord record) {
        delegate.write(jobId, scopeId, recordType, record);
        afterWrite.accept(writes.incrementAndGet());
    }

    public int getWrites() {
        return writes.get();
    }

    public void reset() {
        writes.set(0);
        afterWrite = n -> { };
    }
}
