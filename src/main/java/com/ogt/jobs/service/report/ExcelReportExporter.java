package com.ogt.jobs.service.report;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

@Component
public class ExcelReportExporter implements ReportExporter {

    private static final int COLUMN_WIDTH = 20 * 256;

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.EXCEL;
    }

    @Override
    public byte[] export(ReportTable table) throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Sheet sheet = workbook.createSheet("Report");
            CellStyle boldStyle = boldStyle(workbook);
            List<String> columns = table.getColumns();

            int rowIndex = 0;
            Row titleRow = sheet.createRow(rowIndex++);
            createCell(titleRow, 0, table.getTitle(), boldStyle);

            Row headerRow = sheet.createRow(rowIndex++);
            for (int c = 0; c < columns.size(); c++) {
                createCell(headerRow, c, columns.get(c), boldStyle);
            }

            for (ReportTable.Group group : table.getGroups()) {
                if (table.isGrouped()) {
                    Row groupRow = sheet.createRow(rowIndex++);
                    createCell(groupRow, 0, table.getGroupBy() + ": " + group.getKey()
                            + " (" + group.getRows().size() + ")", boldStyle);
                }
                for (Map<String, String> values : group.getRows()) {
                    Row row = sheet.createRow(rowIndex++);
                    for (int c = 0; c < columns.size(); c++) {
                        createCell(row, c, values.get(columns.get(c)), null);
                    }
                }
            }

            // Ancho fijo: autoSizeColumn depende de fuentes AWT en el servidor
            for (int c = 0; c < columns.size(); c++) {
                sheet.setColumnWidth(c, COLUMN_WIDTH);
            }

            workbook.write(out);
            return out.toByteArray();
        }
    }

    private static void createCell(Row row, int column, String value, CellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value != null ? value : "");
        if (style != null) cell.setCellStyle(style);
    }

    private static CellStyle boldStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        return style;
    }
}
