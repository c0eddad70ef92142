package com.vibeforge.orchestrator.dto;

import com.vibeforge.core.data.ColumnSpec;
import com.vibeforge.core.data.DataShape;
import com.vibeforge.core.data.DataTable;

import java.util.List;
import java.util.Map;

/**
 * Request body for creating or revising an artifact.
 *
 * {@code dataShape} may be given without rows (e.g. when only a sample is sent);
 * when absent it is the shape of {@code columns} x {@code rows}.
 */
public class ArtifactRequest {

    private String                    description;
    private String                    dataVariableName;
    private List<ColumnSpec>          columns;
    private List<Map<String, Object>> rows;
    private DataShape                 dataShape;
    private Map<String, String>       exports;
    private Map<String, String>       imports;
    private String                    theme;
    private String                    baseArtifactId;

    public ArtifactRequest() {
    }

    public ArtifactRequest(String description, DataShape dataShape) {
        this.description = description;
        this.dataShape   = dataShape;
    }

    public DataTable toDataTable() {
        if (columns == null || columns.isEmpty()) return DataTable.EMPTY;
        return new DataTable(columns, rows != null ? rows : List.of());
    }

    public DataShape resolveDataShape() {
        return dataShape != null ? dataShape : toDataTable().getShape();
    }

    public String                    getDescription()      { return description; }
    public String                    getDataVariableName() { return dataVariableName; }
    public List<ColumnSpec>          getColumns()          { return columns; }
    public List<Map<String, Object>> getRows()             { return rows; }
    public DataShape                 getDataShape()        { return dataShape; }
    public Map<String, String>       getExports()          { return exports; }
    public Map<String, String>       getImports()          { return imports; }
    public String                    getTheme()            { return theme; }
    public String                    getBaseArtifactId()   { return baseArtifactId; }

    public void setDescription(String description)             { this.description = description; }
    public void setDataVariableName(String dataVariableName)   { this.dataVariableName = dataVariableName; }
    public void setColumns(List<ColumnSpec> columns)           { this.columns = columns; }
    public void setRows(List<Map<String, Object>> rows)        { this.rows = rows; }
    public void setDataShape(DataShape dataShape)              { this.dataShape = dataShape; }
    public void setExports(Map<String, String> exports)        { this.exports = exports; }
    public void setImports(Map<String, String> imports)        { this.imports = imports; }
    public void setTheme(String theme)                         { this.theme = theme; }
    public void setBaseArtifactId(String baseArtifactId)       { this.baseArtifactId = baseArtifactId; }
}
