package com.vibeforge.core.data;

import java.util.List;
import java.util.Map;

/**
 * DataContext: what the collaborator is told about the dataset and the state-sharing contract.
 *
 * Built once per request in the ANALYZING phase. {@code geospatial} and
 * {@code temporalColumns} are name/dtype pattern matches only; prompts may
 * mention them but nothing downstream branches on them.
 */
public final class DataContext {

    private final List<String>              columns;
    private final Map<String, String>       dtypes;
    private final DataShape                 shape;
    private final List<Map<String, Object>> sample;
    private final Map<String, String>       exports;
    private final Map<String, String>       imports;
    private final String                    theme;
    private final boolean                   geospatial;
    private final List<String>              temporalColumns;

    DataContext(List<String> columns, Map<String, String> dtypes, DataShape shape,
                List<Map<String, Object>> sample, Map<String, String> exports,
                Map<String, String> imports, String theme, boolean geospatial,
                List<String> temporalColumns) {
        this.columns         = columns;
        this.dtypes          = dtypes;
        this.shape           = shape;
        this.sample          = sample;
        this.exports         = exports;
        this.imports         = imports;
        this.theme           = theme;
        this.geospatial      = geospatial;
        this.temporalColumns = temporalColumns;
    }

    public List<String>              getColumns()         { return columns; }
    public Map<String, String>       getDtypes()          { return dtypes; }
    public DataShape                 getShape()           { return shape; }
    public List<Map<String, Object>> getSample()          { return sample; }
    public Map<String, String>       getExports()         { return exports; }
    public Map<String, String>       getImports()         { return imports; }
    public String                    getTheme()           { return theme; }
    public boolean                   isGeospatial()       { return geospatial; }
    public List<String>              getTemporalColumns() { return temporalColumns; }

    @Override
    public String toString() {
        return "DataContext{shape=" + shape + ", columns=" + columns.size()
                + ", exports=" + exports.keySet() + ", imports=" + imports.keySet() + "}";
    }
}
