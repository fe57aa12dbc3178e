package com.ogt.jobs.validation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fila tal como llega de la planilla o del cuerpo JSON, con claves ya canónicas.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawRow {

    private int rowNumber;
    private Map<String, String> fields = new LinkedHashMap<>();
}
