package com.vibeforge.core.data;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class DataContextBuilder {

    static final int SAMPLE_ROWS = 3;

    private static final Set<String> GEO_COLUMN_NAMES =
            Set.of("lat", "latitude", "lon", "longitude", "lng", "geometry");

    private static final Set<String> TEMPORAL_COLUMN_NAMES =
            Set.of("date", "time", "datetime", "timestamp");

    public DataContext build(DataTable table,
                             Map<String, String> exports,
                             Map<String, String> imports,
                             String theme) {
        return build(table, null, exports, imports, theme);
    }

    /**
     * @param declaredShape shape to report when the caller knows more than the
     *                      rows it handed over (e.g. only a sample); null means
     *                      the table's own shape
     */
    public DataContext build(DataTable table,
                             DataShape declaredShape,
                             Map<String, String> exports,
                             Map<String, String> imports,
                             String theme) {

        DataTable data = table != null ? table : DataTable.EMPTY;

        List<String>        columns = new ArrayList<>();
        Map<String, String> dtypes  = new LinkedHashMap<>();
        boolean             geo     = false;
        List<String>        temporal = new ArrayList<>();

        for (ColumnSpec column : data.getColumns()) {
            String name  = column.getName();
            String lower = name.toLowerCase(Locale.ROOT);
            columns.add(name);
            dtypes.put(name, column.getDtype());

            if (GEO_COLUMN_NAMES.contains(lower)) geo = true;
            if (isTemporalDtype(column.getDtype()) || TEMPORAL_COLUMN_NAMES.contains(lower)) {
                temporal.add(name);
            }
        }

        return new DataContext(
                Collections.unmodifiableList(columns),
                Collections.unmodifiableMap(dtypes),
                declaredShape != null ? declaredShape : data.getShape(),
                data.head(SAMPLE_ROWS),
                copyOf(exports),
                copyOf(imports),
                theme,
                geo,
                Collections.unmodifiableList(temporal)
        );
    }

    private static boolean isTemporalDtype(String dtype) {
        String lower = dtype.toLowerCase(Locale.ROOT);
        return lower.startsWith("datetime") || lower.equals("date") || lower.equals("timestamp");
    }

    private static Map<String, String> copyOf(Map<String, String> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
