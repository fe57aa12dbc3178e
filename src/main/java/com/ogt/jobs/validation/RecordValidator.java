package com.ogt.jobs.validation;

import com.ogt.jobs.config.JobProperties;
import com.ogt.jobs.exception.BatchTooLargeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Motor de validación: filas crudas a {válidas, inválidas} con diagnóstico por fila.
 * Sin estado ni efectos, se usa igual para la vista previa y para el alta del job.
 */
@Slf4j
@Component
public class RecordValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final int PHONE_DIGITS = 10;

    private final int maxBatchSize;

    public RecordValidator(JobProperties properties) {
        this.maxBatchSize = properties.getBatch().getMaxRows();
    }

    public ValidationResult validate(ImportSchema schema, List<RawRow> rows) {
        if (rows.size() > maxBatchSize) {
            throw new BatchTooLargeException(rows.size(), maxBatchSize);
        }

        List<ImportRecord> valid = new ArrayList<>();
        List<ImportRecord> invalid = new ArrayList<>();
        // Valores vistos por campo identificador: una fila repite si coincide en cualquiera de ellos
        Map<String, Set<String>> seen = new HashMap<>();

        for (RawRow row : rows) {
            ImportRecord record = validateRow(schema, row);

            if (repeatsAnIdentifier(schema, record, seen)) {
                record.getErrors().add(schema.getDuplicateMessage());
            }

            if (record.isValid()) valid.add(record);
            else invalid.add(record);
        }

        log.debug("Validación {}: {} válidas, {} inválidas de {}", schema, valid.size(), invalid.size(), rows.size());

        return ValidationResult.builder()
                .schema(schema)
                .totalRows(rows.size())
                .valid(valid)
                .invalid(invalid)
                .build();
    }

    private static boolean repeatsAnIdentifier(ImportSchema schema, ImportRecord record,
                                               Map<String, Set<String>> seen) {
        boolean repeated = false;
        for (FieldSpec field : schema.identifierFields()) {
            String value = record.getFields().get(field.getName());
            if (value == null) continue;
            if (!seen.computeIfAbsent(field.getName(), k -> new HashSet<>()).add(value.toLowerCase())) {
                repeated = true;
            }
        }
        return repeated;
    }

    private ImportRecord validateRow(ImportSchema schema, RawRow row) {
        Map<String, String> values = clean(row.getFields());
        ImportRecord record = ImportRecord.builder()
                .rowNumber(row.getRowNumber())
                .identifier(schema.resolveIdentifier(values))
                .fields(values)
                .build();

        if (record.getIdentifier() == null) {
            record.getErrors().add("At least one identifier (" + schema.identifierLabels() + ") is required");
        }

        for (FieldSpec field : schema.requiredFields()) {
            if (!values.containsKey(field.getName())) {
                record.getErrors().add(field.getHeader() + " is required");
            }
        }

        for (FieldSpec field : schema.getFields()) {
            String value = values.get(field.getName());
            if (value == null) continue;

            String problem = checkFormat(field, value);
            if (problem == null) continue;

            if (field.isStrict()) record.getErrors().add(problem);
            else record.getWarnings().add(problem);
        }
        return record;
    }

    private String checkFormat(FieldSpec field, String value) {
        return switch (field.getFormat()) {
            case TEXT -> null;
            case EMAIL -> EMAIL.matcher(value).matches()
                    ? null : "Invalid " + field.getHeader() + " format";
            case PHONE -> isValidPhone(value)
                    ? null : "Invalid " + field.getHeader() + " format: expected " + PHONE_DIGITS + " digits";
            case DATE -> isValidDate(value)
                    ? null : "Invalid date format: " + value + ". Expected format: YYYY-MM-DD";
            case SEMESTER -> isValidSemester(value)
                    ? null : "Semester must be between 1 and 8";
        };
    }

    static boolean isValidPhone(String value) {
        String digits = value.replaceAll("\\D", "");
        if (digits.length() == PHONE_DIGITS + 2 && digits.startsWith("91")) {
            digits = digits.substring(2);
        }
        return digits.length() == PHONE_DIGITS;
    }

    private static boolean isValidDate(String value) {
        try {
            LocalDate.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isValidSemester(String value) {
        try {
            int semester = Integer.parseInt(value);
            return semester >= 1 && semester <= 8;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // Recorta y descarta celdas vacías: un campo en blanco equivale a ausente
    private static Map<String, String> clean(Map<String, String> raw) {
        Map<String, String> values = new LinkedHashMap<>();
        if (raw == null) return values;
        raw.forEach((k, v) -> {
            if (v != null && !v.isBlank()) values.put(k, v.trim());
        });
        return values;
    }
}
