package com.enterprise.morpher.migration.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row bound for the target table, keyed by target column in insert order.
 */
public final class TargetRow {

    private final Map<String, FieldValue> values;

    public TargetRow(Map<String, FieldValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Convenience for tests and transforms: raw values, {@code null} meaning absent. */
    public static TargetRow of(Map<String, ?> rawValues) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        rawValues.forEach((column, value) -> values.put(column, FieldValue.of(value)));
        return new TargetRow(values);
    }

    /**
     * @throws IllegalArgumentException if the column is not part of the row
     */
    public FieldValue get(String column) {
        FieldValue value = values.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Column not in target row: " + column);
        }
        return value;
    }

    public Object valueOf(String column) {
        return get(column).orNull();
    }

    public List<String> columns() {
        return new ArrayList<>(values.keySet());
    }

    /** Raw values in column order, {@code null} for absent. */
    public Object[] rawValues() {
        return values.values().stream().map(FieldValue::orNull).toArray();
    }

    /**
     * Diagnostic key of the row: first column and its value, e.g. {@code id=2}.
     */
    public String identifier() {
        if (values.isEmpty()) {
            return "<empty row>";
        }
        Map.Entry<String, FieldValue> first = values.entrySet().iterator().next();
        return first.getKey() + "=" + first.getValue();
    }

    public Map<String, FieldValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TargetRow other && values.equals(other.values);
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
