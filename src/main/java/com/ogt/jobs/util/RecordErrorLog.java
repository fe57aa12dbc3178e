package com.ogt.jobs.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Errores por registro de una corrida de importación. Se guarda como JSON en
 * {@code jobs.record_errors} y se archiva tal cual al reintentar.
 */
@Data
public class RecordErrorLog {

    private static final TypeReference<List<RecordError>> LIST_TYPE = new TypeReference<>() {};

    private List<RecordError> errors = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecordError {
        private int rowNumber;
        private String identifier;
        private List<String> errors;
    }

    public void addError(int rowNumber, String identifier, String message) {
        errors.add(new RecordError(rowNumber, identifier, List.of(message)));
    }

    public int getErrorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public String getSummary() {
        if (errors.isEmpty()) {
            return "Sin errores";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Total de errores: %d%n", errors.size()));
        errors.stream()
                .limit(5)
                .forEach(e -> sb.append(String.format("Fila %d (%s): %s%n", e.rowNumber, e.identifier, String.join("; ", e.errors))));

        if (errors.size() > 5) {
            sb.append(String.format("... y %d más%n", errors.size() - 5));
        }
        return sb.toString();
    }

    public String toJson(ObjectMapper objectMapper) {
        if (errors.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(errors);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error converting RecordErrorLog to JSON", e);
        }
    }

    public static List<RecordError> fromJson(ObjectMapper objectMapper, String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error reading record errors JSON", e);
        }
    }
}
