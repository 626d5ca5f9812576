package com.example.ev_valuation.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header + string cells as read from a CSV file or the first sheet of a
 * workbook. Header names are trimmed and lower-cased on construction.
 */
public final class RawTable {

    private final List<String> columns;
    private final Map<String, Integer> indexByColumn;
    private final List<List<String>> rows;

    public RawTable(List<String> header, List<List<String>> rows) {
        List<String> cols = new ArrayList<>(header.size());
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String c = header.get(i) == null ? "" : header.get(i).trim().toLowerCase(Locale.ROOT);
            cols.add(c);
            idx.putIfAbsent(c, i);
        }
        this.columns = Collections.unmodifiableList(cols);
        this.indexByColumn = idx;
        this.rows = List.copyOf(rows);
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public boolean hasColumns(String... names) {
        for (String n : names) {
            if (!indexByColumn.containsKey(n)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Trimmed cell value, or null when the column is absent or the cell is
     * empty / short.
     */
    public String cell(List<String> row, String column) {
        Integer i = indexByColumn.get(column);
        if (i == null || i >= row.size() || row.get(i) == null) {
            return null;
        }
        String v = row.get(i).trim();
        return v.isEmpty() ? null : v;
    }
}
