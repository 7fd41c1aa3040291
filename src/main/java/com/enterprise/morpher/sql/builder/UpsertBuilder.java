package com.enterprise.morpher.sql.builder;

import com.enterprise.morpher.sql.core.UpsertStyle;
import com.enterprise.morpher.sql.param.ParameterBinder;
import com.enterprise.morpher.sql.validation.ExpressionValidator;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Fluent builder for multi-row upsert statements in the syntax of an
 * {@link UpsertStyle}.
 *
 * <p>Unsupported: conditional updates, partial column updates, DELETE on match.
 *
 * <p>Produces one of:
 * <pre>
 * MERGE INTO target (id, name) KEY (id) VALUES (:id_1, :name_1), (:id_2, :name_2)
 * INSERT INTO target (id, name) VALUES (...) ON CONFLICT (id) DO UPDATE SET name = EXCLUDED.name
 * INSERT INTO target (id, name) VALUES (...) ON DUPLICATE KEY UPDATE name = VALUES(name)
 * </pre>
 *
 * <p>Example:
 * <pre>{@code
 * SqlResult r = UpsertBuilder.upsert(UpsertStyle.MERGE_KEY)
 *     .into("new_users")
 *     .columns("id", "username")
 *     .keys("id")
 *     .valuesOrNull(1, "a")
 *     .build();
 * }</pre>
 */
public class UpsertBuilder {

    private final ParameterBinder binder;
    private final UpsertStyle style;
    private String table;
    private final List<String> columns = new ArrayList<>();
    private final List<String> keys = new ArrayList<>();
    private final List<Object[]> rows = new ArrayList<>();

    private UpsertBuilder(ParameterBinder binder, UpsertStyle style) {
        this.binder = binder;
        this.style = Objects.requireNonNull(style, "style");
    }

    public static UpsertBuilder upsert(UpsertStyle style) {
        return new UpsertBuilder(new ParameterBinder(), style);
    }

    public UpsertBuilder into(String table) {
        ExpressionValidator.validateIdentifier(table);
        this.table = table;
        return this;
    }

    public UpsertBuilder columns(List<String> cols) {
        for (String col : cols) {
            ExpressionValidator.validateIdentifier(col);
            columns.add(col);
        }
        return this;
    }

    public UpsertBuilder columns(String... cols) {
        return columns(Arrays.asList(cols));
    }

    /**
     * Match key columns; each must also be one of {@link #columns}.
     */
    public UpsertBuilder keys(List<String> keyColumns) {
        keys.addAll(keyColumns);
        return this;
    }

    public UpsertBuilder keys(String... keyColumns) {
        return keys(Arrays.asList(keyColumns));
    }

    public UpsertBuilder valuesOrNull(Object... values) {
        if (values.length != columns.size()) {
            throw new IllegalArgumentException(
                    "Value count (" + values.length + ") != column count (" + columns.size() + ")");
        }
        rows.add(values.clone());
        return this;
    }

    public SqlResult build() {
        validate();
        String colNames = String.join(", ", columns);
        String tuples = rows.stream()
                .map(row -> "(" + String.join(", ", binder.bindRow(columns, row)) + ")")
                .collect(Collectors.joining(", "));
        List<String> updated = columns.stream()
                .filter(c -> !keys.contains(c))
                .toList();

        StringBuilder sql = new StringBuilder();
        switch (style) {
            case MERGE_KEY -> sql.append("MERGE INTO ").append(table)
                    .append(" (").append(colNames).append(")")
                    .append(" KEY (").append(String.join(", ", keys)).append(")")
                    .append(" VALUES ").append(tuples);
            case ON_CONFLICT -> {
                sql.append("INSERT INTO ").append(table)
                   .append(" (").append(colNames).append(")")
                   .append(" VALUES ").append(tuples)
                   .append(" ON CONFLICT (").append(String.join(", ", keys)).append(")");
                if (updated.isEmpty()) {
                    sql.append(" DO NOTHING");
                } else {
                    sql.append(" DO UPDATE SET ").append(updated.stream()
                            .map(c -> c + " = EXCLUDED." + c)
                            .collect(Collectors.joining(", ")));
                }
            }
            case ON_DUPLICATE_KEY -> {
                sql.append("INSERT INTO ").append(table)
                   .append(" (").append(colNames).append(")")
                   .append(" VALUES ").append(tuples)
                   .append(" ON DUPLICATE KEY UPDATE ");
                if (updated.isEmpty()) {
                    // no-op assignment keeps the statement valid
                    sql.append(keys.get(0)).append(" = ").append(keys.get(0));
                } else {
                    sql.append(updated.stream()
                            .map(c -> c + " = VALUES(" + c + ")")
                            .collect(Collectors.joining(", ")));
                }
            }
            case NONE -> throw new IllegalStateException("Upsert not supported by this dialect");
        }
        return new SqlResult(sql.toString(), binder.getParameters());
    }

    private void validate() {
        Objects.requireNonNull(table, "target table required (call .into(table))");
        if (columns.isEmpty()) {
            throw new IllegalStateException("No columns (call .columns())");
        }
        if (keys.isEmpty()) {
            throw new IllegalStateException("Key columns required (call .keys())");
        }
        for (String key : keys) {
            if (!columns.contains(key)) {
                throw new IllegalStateException("Key column '" + key + "' is not an inserted column");
            }
        }
        if (rows.isEmpty()) {
            throw new IllegalStateException("No values (call .valuesOrNull())");
        }
    }
}
