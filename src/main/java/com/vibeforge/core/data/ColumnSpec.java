package com.vibeforge.core.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** One column of a tabular dataset: its name and a coarse dtype label ("int64", "datetime64", "object"...). */
public final class ColumnSpec {

    private final String name;
    private final String dtype;

    @JsonCreator
    public ColumnSpec(@JsonProperty("name") String name, @JsonProperty("dtype") String dtype) {
        this.name  = Objects.requireNonNull(name, "name");
        this.dtype = dtype != null ? dtype : "object";
    }

    public String getName()  { return name; }
    public String getDtype() { return dtype; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnSpec)) return false;
        ColumnSpec that = (ColumnSpec) o;
        return name.equals(that.name) && dtype.equals(that.dtype);
    }

    @Override
    public int hashCode() { return Objects.hash(name, dtype); }

    @Override
    public String toString() { return name + ":" + dtype; }
}
