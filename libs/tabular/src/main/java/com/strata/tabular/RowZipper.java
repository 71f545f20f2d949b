package com.strata.tabular;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs positional values with header names. Values past the last header are dropped and
 * a short row yields only the columns it has.
 */
final class RowZipper {

    private RowZipper() {
        // utility class
    }

    static Map<String, String> zip(List<String> headers, List<String> values) {
        int width = Math.min(headers.size(), values.size());
        Map<String, String> row = new LinkedHashMap<>(width * 2);
        for (int i = 0; i < width; i++) {
            row.put(headers.get(i), values.get(i));
        }
        return row;
    }
}
