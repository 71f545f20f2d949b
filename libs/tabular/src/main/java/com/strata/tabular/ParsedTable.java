package com.strata.tabular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of parsing a tabular file: ordered header names and one map per data row.
 *
 * <p>Row maps iterate in header order and contain only the columns the row actually had.
 *
 * @param headers column names in file order
 * @param rows    data rows keyed by column name
 */
public record ParsedTable(List<String> headers, List<Map<String, String>> rows) {

    public ParsedTable {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        headers = List.copyOf(headers);
        rows = rows.stream()
                .map(row -> Collections.unmodifiableMap(new LinkedHashMap<>(row)))
                .toList();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
