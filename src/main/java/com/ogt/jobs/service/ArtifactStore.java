package com.ogt.jobs.service;

import java.io.IOException;
import java.util.UUID;

/**
 * Almacén de archivos generados por los reportes. La referencia devuelta por
 * {@link #store} es la que se guarda en {@code Job.artifactRef}.
 */
public interface ArtifactStore {

    String store(UUID jobId, String fileName, byte[] content) throws IOException;

    byte[] load(String artifactRef) throws IOException;

    void delete(String artifactRef) throws IOException;
}
