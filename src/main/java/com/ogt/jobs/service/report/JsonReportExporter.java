package com.ogt.jobs.service.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class JsonReportExporter implements ReportExporter {

    private final ObjectMapper objectMapper;

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }

    @Override
    public byte[] export(ReportTable table) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("title", table.getTitle());
        root.put("totalRows", table.getRowCount());
        root.set("columns", objectMapper.valueToTree(table.getColumns()));

        if (table.isGrouped()) {
            root.put("groupBy", table.getGroupBy());
            ArrayNode groups = root.putArray("groups");
            for (ReportTable.Group group : table.getGroups()) {
                ObjectNode node = groups.addObject();
                node.put("key", group.getKey());
                node.put("count", group.getRows().size());
                node.set("rows", objectMapper.valueToTree(group.getRows()));
            }
        } else {
            ArrayNode rows = root.putArray("rows");
            for (ReportTable.Group group : table.getGroups()) {
                for (Map<String, String> row : group.getRows()) {
                    rows.add(objectMapper.valueToTree(row));
                }
            }
        }
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
    }
}
