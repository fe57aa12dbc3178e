package com.ogt.jobs.service.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Salida tabular ya filtrada, ordenada y agrupada, lista para exportar.
 * Sin {@code groupBy} hay un único grupo con clave {@code null}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportTable {

    private String title;
    private List<String> columns;
    private String groupBy;

    @Builder.Default
    private List<Group> groups = new ArrayList<>();

    public int getRowCount() {
        return groups.stream().mapToInt(g -> g.getRows().size()).sum();
    }

    public boolean isEmpty() {
        return getRowCount() == 0;
    }

    public boolean isGrouped() {
        return groupBy != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Group {
        private String key;
        private List<Map<String, String>> rows = new ArrayList<>();
    }
}
