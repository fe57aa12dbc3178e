package com.ogt.jobs.validation;

import lombok.Getter;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Una columna de la planilla: nombre canónico, encabezado de la plantilla,
 * alias aceptados, formato y rol dentro del registro.
 */
@Getter
public final class FieldSpec {

    public enum Role { IDENTIFIER, REQUIRED, OPTIONAL }

    public enum Format { TEXT, EMAIL, PHONE, DATE, SEMESTER }

    private final String name;
    private final String header;
    private final Format format;
    private final Role role;
    private final boolean strict;
    private final Set<String> aliases;

    private FieldSpec(String name, String header, Format format, Role role, boolean strict, String... aliases) {
        this.name = name;
        this.header = header;
        this.format = format;
        this.role = role;
        this.strict = strict;
        this.aliases = new LinkedHashSet<>(Arrays.asList(aliases));
    }

    public static FieldSpec identifier(String name, String header, Format format, String... aliases) {
        return new FieldSpec(name, header, format, Role.IDENTIFIER, true, aliases);
    }

    public static FieldSpec required(String name, String header, Format format, String... aliases) {
        return new FieldSpec(name, header, format, Role.REQUIRED, true, aliases);
    }

    /** Campo opcional: un formato inválido sólo produce advertencia. */
    public static FieldSpec optional(String name, String header, Format format, String... aliases) {
        return new FieldSpec(name, header, format, Role.OPTIONAL, false, aliases);
    }

    /** Campo opcional cuyo formato inválido sí invalida la fila. */
    public static FieldSpec optionalStrict(String name, String header, Format format, String... aliases) {
        return new FieldSpec(name, header, format, Role.OPTIONAL, true, aliases);
    }

    /**
     * Claves normalizadas (sólo alfanuméricos, minúsculas) bajo las que se
     * reconoce esta columna en un encabezado.
     */
    public Set<String> headerKeys() {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(normalizeHeader(name));
        keys.add(normalizeHeader(header));
        aliases.forEach(a -> keys.add(normalizeHeader(a)));
        return keys;
    }

    public static String normalizeHeader(String raw) {
        if (raw == null) return "";
        return raw.replaceAll("[\n\r]+", " ").replaceAll("[^a-zA-Z0-9]", "").toLowerCase();
    }
}
