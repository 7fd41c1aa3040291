package com.enterprise.morpher.sql.param;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named parameters of a multi-row statement.
 *
 * <p>Rows are numbered from 1 in bind order; the value of column {@code c} in row
 * {@code r} is bound as {@code :c_r}. Null values are not bound: their placeholder
 * is the {@code NULL} literal. Values are stored unchanged, type conversion is left
 * to the JDBC driver.
 *
 * <pre>{@code
 * binder.bindRow(List.of("id", "phone"), new Object[] {2, null}); // [":id_1", "NULL"]
 * }</pre>
 */
public class ParameterBinder {

    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private int rows;

    /**
     * Binds one row and returns its placeholders in column order.
     *
     * @throws IllegalArgumentException if the value count differs from the column count
     */
    public List<String> bindRow(List<String> columns, Object[] values) {
        if (values.length != columns.size()) {
            throw new IllegalArgumentException(
                    "Value count (" + values.length + ") != column count (" + columns.size() + ")");
        }
        int row = ++rows;
        List<String> placeholders = new ArrayList<>(columns.size());
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                placeholders.add("NULL");
                continue;
            }
            String name = parameterName(columns.get(i), row);
            if (parameters.putIfAbsent(name, values[i]) != null) {
                throw new IllegalArgumentException("Column bound twice in row " + row + ": " + columns.get(i));
            }
            placeholders.add(":" + name);
        }
        return placeholders;
    }

    public int rowCount() {
        return rows;
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    // qualified names (users.id) are not valid parameter names
    static String parameterName(String column, int row) {
        String cleaned = column == null ? "" : column.replaceAll("\\W", "_");
        return (cleaned.isEmpty() ? "p" : cleaned) + "_" + row;
    }
}
