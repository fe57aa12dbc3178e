package com.ogt.jobs.service.report;

import com.ogt.jobs.dto.ReportConfig;
import com.ogt.jobs.validation.FieldSpec;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Fase 2 del reporte: filtros, selección de columnas, orden y agrupamiento.
 */
@Component
public class ReportAssembler {

    static final String EMPTY_GROUP = "(empty)";

    public ReportTable assemble(List<Map<String, String>> rows, ReportConfig config) {
        List<Map<String, String>> filtered = rows.stream()
                .filter(row -> matches(row, config.getFilters()))
                .collect(Collectors.toCollection(ArrayList::new));

        if (config.getSortBy() != null && !config.getSortBy().isBlank()) {
            String sortBy = config.getSortBy();
            boolean descending = config.isDescending();
            filtered.sort((a, b) -> compareValues(a.get(sortBy), b.get(sortBy), descending));
        }

        List<String> columns = resolveColumns(filtered, config);
        List<Map<String, String>> projected = filtered.stream()
                .map(row -> project(row, columns, config.getGroupBy()))
                .toList();

        return ReportTable.builder()
                .title(config.getTitle() != null ? config.getTitle() : defaultTitle(config))
                .columns(columns)
                .groupBy(blankToNull(config.getGroupBy()))
                .groups(group(projected, blankToNull(config.getGroupBy())))
                .build();
    }

    // ========== FILTROS ==========

    private static boolean matches(Map<String, String> row, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) return true;
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Set<String> accepted = acceptedValues(filter.getValue());
            if (accepted.isEmpty()) continue;
            String value = row.get(filter.getKey());
            if (value == null || !accepted.contains(value.trim().toLowerCase())) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> acceptedValues(Object filterValue) {
        Set<String> accepted = new HashSet<>();
        if (filterValue instanceof Collection<?> values) {
            values.stream().filter(Objects::nonNull).forEach(v -> accepted.add(v.toString().trim().toLowerCase()));
        } else if (filterValue != null) {
            accepted.add(filterValue.toString().trim().toLowerCase());
        }
        return accepted;
    }

    // ========== COLUMNAS ==========

    private static List<String> resolveColumns(List<Map<String, String>> rows, ReportConfig config) {
        if (config.getColumns() != null && !config.getColumns().isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(config.getColumns()));
        }
        // Todas las columnas presentes, en el orden del esquema
        Set<String> present = new HashSet<>();
        rows.forEach(row -> present.addAll(row.keySet()));
        List<String> columns = new ArrayList<>();
        for (FieldSpec field : config.getReportType().getFields()) {
            if (present.remove(field.getName())) columns.add(field.getName());
        }
        present.stream().sorted().forEach(columns::add);
        return columns;
    }

    private static Map<String, String> project(Map<String, String> row, List<String> columns, String groupBy) {
        Map<String, String> projected = new LinkedHashMap<>();
        columns.forEach(column -> projected.put(column, row.get(column)));
        if (groupBy != null && !projected.containsKey(groupBy)) {
            projected.put(groupBy, row.get(groupBy));
        }
        return projected;
    }

    // ========== AGRUPAMIENTO ==========

    private static List<ReportTable.Group> group(List<Map<String, String>> rows, String groupBy) {
        if (groupBy == null) {
            return rows.isEmpty() ? new ArrayList<>() : new ArrayList<>(List.of(new ReportTable.Group(null, rows)));
        }
        // Grupos por clave ascendente; dentro de cada grupo se respeta el orden de sortBy
        Map<String, List<Map<String, String>>> grouped = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map<String, String> row : rows) {
            String value = row.get(groupBy);
            String key = value == null || value.isBlank() ? EMPTY_GROUP : value;
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        List<ReportTable.Group> groups = new ArrayList<>();
        grouped.forEach((key, groupRows) -> groups.add(new ReportTable.Group(key, groupRows)));
        return groups;
    }

    // Vacíos al final; numéricos como números; el resto sin distinguir mayúsculas
    static int compareValues(String a, String b, boolean descending) {
        boolean aEmpty = a == null || a.isBlank();
        boolean bEmpty = b == null || b.isBlank();
        if (aEmpty || bEmpty) return Boolean.compare(aEmpty, bEmpty);

        BigDecimal na = toNumber(a);
        BigDecimal nb = toNumber(b);
        int result = na != null && nb != null ? na.compareTo(nb) : a.compareToIgnoreCase(b);
        return descending ? -result : result;
    }

    private static BigDecimal toNumber(String value) {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String defaultTitle(ReportConfig config) {
        return config.getReportType().name().charAt(0) + config.getReportType().name().substring(1).toLowerCase()
                .replace('_', ' ') + " report";
    }
}
