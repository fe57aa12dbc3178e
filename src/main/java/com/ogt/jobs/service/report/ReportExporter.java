package com.ogt.jobs.service.report;

import java.io.IOException;

/**
 * Fase 3 del reporte: serializa la tabla en un formato de descarga.
 */
public interface ReportExporter {

    ReportFormat getFormat();

    byte[] export(ReportTable table) throws IOException;
}
