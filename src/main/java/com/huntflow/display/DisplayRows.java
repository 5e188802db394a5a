package com.huntflow.display;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tabular rows produced by DISP
 */
public class DisplayRows implements Display {

    @JsonProperty("columns")
    private final List<String> columns;

    @JsonProperty("rows")
    private final List<Map<String, Object>> rows;

    public DisplayRows(List<Map<String, Object>> rows) {
        this.rows = rows != null ? rows : new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        this.rows.forEach(row -> names.addAll(row.keySet()));
        this.columns = new ArrayList<>(names);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    @Override
    public String render() {
        if (rows.isEmpty()) {
            return "(no rows)";
        }
        int[] widths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            widths[i] = columns.get(i).length();
            for (Map<String, Object> row : rows) {
                widths[i] = Math.max(widths[i], cell(row, columns.get(i)).length());
            }
        }
        StringBuilder sb = new StringBuilder();
        appendLine(sb, columns, widths);
        for (Map<String, Object> row : rows) {
            List<String> cells = new ArrayList<>(columns.size());
            columns.forEach(c -> cells.add(cell(row, c)));
            appendLine(sb, cells, widths);
        }
        return sb.toString();
    }

    private static String cell(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? "" : String.valueOf(value);
    }

    private static void appendLine(StringBuilder sb, List<String> cells, int[] widths) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                sb.append("  ");
            }
            String cell = cells.get(i);
            sb.append(cell);
            if (i < cells.size() - 1) {
                sb.append(" ".repeat(widths[i] - cell.length()));
            }
        }
        sb.append('\n');
    }
}
