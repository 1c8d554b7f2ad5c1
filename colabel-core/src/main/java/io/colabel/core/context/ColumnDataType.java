package io.colabel.core.context;

/// Declared data type of a result-set column.
public enum ColumnDataType {
    NUMERIC,
    STRING,
    TEMPORAL,
    BOOLEAN
}
