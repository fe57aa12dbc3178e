package com.ogt.jobs.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fila validada. Nunca se persiste sola: viaja dentro del payload del job
 * (si es válida) o vuelve al cliente con sus errores (si no lo es).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportRecord {

    private int rowNumber;
    private String identifier;

    @Builder.Default
    private Map<String, String> fields = new LinkedHashMap<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @JsonIgnore
    public boolean isValid() {
        return errors.isEmpty();
    }
}
