package com.ogt.jobs.service;

import com.ogt.jobs.exception.BusinessException;
import com.ogt.jobs.validation.ImportSchema;
import com.ogt.jobs.validation.RawRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Lee planillas subidas (.xlsx, .xls, .csv) y devuelve filas crudas con
 * claves canónicas del esquema. No valida: eso es del {@code RecordValidator}.
 */
@Slf4j
@Component
public class TabularFileParser {

    private static final int HEADER_SEARCH_LIMIT = 50;
    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final DataFormatter dataFormatter = new DataFormatter();

    public List<RawRow> parse(String fileName, byte[] content, ImportSchema schema) {
        if (content == null || content.length == 0) {
            throw new BusinessException("Uploaded file is empty");
        }
        String lowerName = fileName != null ? fileName.toLowerCase() : "";

        List<RawRow> rows;
        if (lowerName.endsWith(".xlsx") || lowerName.endsWith(".xls")) {
            rows = parseWorkbook(content, schema);
        } else if (lowerName.endsWith(".csv")) {
            rows = parseCsv(content, schema);
        } else {
            throw new BusinessException("Unsupported file format. Use .xlsx, .xls or .csv");
        }

        log.info("📊 Archivo {} leído: {} filas de datos", fileName, rows.size());
        return rows;
    }

    // ========== EXCEL ==========

    private List<RawRow> parseWorkbook(byte[] content, ImportSchema schema) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            Sheet sheet = workbook.getSheetAt(0);

            // El encabezado es la primera fila con alguna celda cargada
            int headerRowIndex = -1;
            for (int i = sheet.getFirstRowNum(); i <= sheet.getLastRowNum() && i < HEADER_SEARCH_LIMIT; i++) {
                Row row = sheet.getRow(i);
                if (row != null && row.getPhysicalNumberOfCells() > 0) {
                    headerRowIndex = i;
                    break;
                }
            }
            if (headerRowIndex == -1) {
                throw new BusinessException("The file has no header row");
            }

            Map<Integer, String> columnMap = buildColumnMap(sheet.getRow(headerRowIndex));
            log.debug("📊 Columnas detectadas: {}", columnMap.values());

            List<RawRow> rows = new ArrayList<>();
            for (int i = headerRowIndex + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;

                Map<String, String> raw = new LinkedHashMap<>();
                columnMap.forEach((index, header) -> raw.put(header, getCellValueAsString(row.getCell(index))));
                if (isBlank(raw)) continue;

                // Número de fila tal como lo ve el usuario en la planilla
                rows.add(new RawRow(i + 1, schema.canonicalize(raw)));
            }
            return rows;
        } catch (BusinessException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("❌ No se pudo leer la planilla", e);
            throw new BusinessException("Unable to read spreadsheet: " + e.getMessage(), e);
        }
    }

    private Map<Integer, String> buildColumnMap(Row headerRow) {
        Map<Integer, String> map = new LinkedHashMap<>();
        for (Cell cell : headerRow) {
            String rawValue = getCellValueAsString(cell);
            if (rawValue == null || rawValue.isBlank()) continue;
            map.put(cell.getColumnIndex(), rawValue.replaceAll("[\n\r]+", " ").trim());
        }
        return map;
    }

    private String getCellValueAsString(Cell cell) {
        if (cell == null) return null;
        switch (cell.getCellType()) {
            case STRING: return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().format(ISO_DATE);
                }
                double num = cell.getNumericCellValue();
                return (num == (long) num) ? String.valueOf((long) num) : String.valueOf(num);
            case BOOLEAN: return String.valueOf(cell.getBooleanCellValue());
            case FORMULA: return dataFormatter.formatCellValue(cell);
            default: return null;
        }
    }

    // ========== CSV ==========

    private List<RawRow> parseCsv(byte[] content, ImportSchema schema) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .setAllowMissingColumnNames(true)
                .build();

        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {

            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                throw new BusinessException("The file has no header row");
            }

            List<RawRow> rows = new ArrayList<>();
            // La línea 1 es el encabezado
            int rowNumber = 1;
            for (CSVRecord record : parser) {
                rowNumber++;
                Map<String, String> raw = new LinkedHashMap<>();
                for (String header : headers) {
                    if (header == null || header.isBlank()) continue;
                    raw.put(header, record.isMapped(header) && record.isSet(header) ? record.get(header) : null);
                }
                if (isBlank(raw)) continue;
                rows.add(new RawRow(rowNumber, schema.canonicalize(raw)));
            }
            return rows;
        } catch (IOException | IllegalArgumentException e) {
            log.error("❌ No se pudo leer el CSV", e);
            throw new BusinessException("Unable to read CSV file: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(Map<String, String> raw) {
        return raw.values().stream().allMatch(v -> v == null || v.isBlank());
    }
}
