package com.enterprise.morpher.migration.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One row read from the source, keyed by qualified column ({@code table.column})
 * in SELECT order.
 */
public final class SourceRow {

    private final Map<String, FieldValue> values;

    public SourceRow(Map<String, FieldValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * @throws IllegalArgumentException if the column was not selected
     */
    public FieldValue get(String qualifiedColumn) {
        FieldValue value = values.get(qualifiedColumn);
        if (value == null) {
            throw new IllegalArgumentException("Column not in source row: " + qualifiedColumn);
        }
        return value;
    }

    /** Raw value, {@code null} when absent. */
    public Object valueOf(String qualifiedColumn) {
        return get(qualifiedColumn).orNull();
    }

    public boolean has(String qualifiedColumn) {
        return values.containsKey(qualifiedColumn);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, FieldValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SourceRow other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
