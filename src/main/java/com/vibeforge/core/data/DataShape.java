package com.vibeforge.core.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vibeforge.core.artifact.InvalidRequestException;

/** Row and column count of a dataset. Part of the cache key. */
public final class DataShape {

    public static final DataShape EMPTY = new DataShape(0, 0);

    private final int rows;
    private final int columns;

    @JsonCreator
    public DataShape(@JsonProperty("rows") int rows, @JsonProperty("columns") int columns) {
        if (rows < 0 || columns < 0) {
            throw new InvalidRequestException("Data shape cannot be negative: (" + rows + ", " + columns + ")");
        }
        this.rows    = rows;
        this.columns = columns;
    }

    public int getRows()    { return rows; }
    public int getColumns() { return columns; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataShape)) return false;
        DataShape that = (DataShape) o;
        return rows == that.rows && columns == that.columns;
    }

    @Override
    public int hashCode() { return 31 * rows + columns; }

    @Override
    public String toString() { return "(" + rows + ", " + columns + ")"; }
}
