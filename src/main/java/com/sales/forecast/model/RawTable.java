package com.sales.forecast.model;

import java.util.List;
import java.util.Map;

/**
 * Untyped tabular input: header names and one name-to-text map per row.
 */
public record RawTable(List<String> headers, List<Map<String, String>> rows) {

    public RawTable {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    public boolean hasColumn(String column) {
        return headers.contains(column);
    }
}
