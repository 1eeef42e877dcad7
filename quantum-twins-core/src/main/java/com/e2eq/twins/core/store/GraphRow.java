package com.e2eq.twins.core.store;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A query result row, columns in projection order.
 */
public record GraphRow(Map<String, GraphValue> columns) {

    public GraphRow {
        columns = new LinkedHashMap<>(columns);
    }

    public static GraphRow of(String column, GraphValue value) {
        Map<String, GraphValue> columns = new LinkedHashMap<>();
        columns.put(column, value);
        return new GraphRow(columns);
    }
}
