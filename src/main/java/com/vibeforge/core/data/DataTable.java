package com.vibeforge.core.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An already-parsed tabular dataset: ordered columns plus rows keyed by column name.
 * Parsing files or frames into this shape happens upstream.
 */
public final class DataTable {

    public static final DataTable EMPTY = new DataTable(List.of(), List.of());

    private final List<ColumnSpec>          columns;
    private final List<Map<String, Object>> rows;

    public DataTable(List<ColumnSpec> columns, List<Map<String, Object>> rows) {
        this.columns = List.copyOf(columns);
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<ColumnSpec>          getColumns() { return columns; }
    public List<Map<String, Object>> getRows()    { return rows; }

    public DataShape getShape() {
        return new DataShape(rows.size(), columns.size());
    }

    public List<Map<String, Object>> head(int n) {
        return rows.subList(0, Math.min(n, rows.size()));
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
