package com.ogt.jobs.service.report;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CSV plano: con {@code groupBy} la columna del grupo va primero.
 */
@Component
public class CsvReportExporter implements ReportExporter {

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CSV;
    }

    @Override
    public byte[] export(ReportTable table) throws IOException {
        List<String> columns = new ArrayList<>(table.getColumns());
        if (table.isGrouped()) {
            columns.remove(table.getGroupBy());
            columns.add(0, table.getGroupBy());
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(columns.toArray(new String[0]))
                .build();

        try (CSVPrinter printer = new CSVPrinter(new OutputStreamWriter(out, StandardCharsets.UTF_8), format)) {
            for (ReportTable.Group group : table.getGroups()) {
                for (Map<String, String> row : group.getRows()) {
                    List<String> values = new ArrayList<>(columns.size());
                    for (String column : columns) {
                        values.add(row.get(column));
                    }
                    printer.printRecord(values);
                }
            }
        }
        return out.toByteArray();
    }
}
