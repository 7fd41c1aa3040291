package com.enterprise.morpher.sql.builder;

import com.enterprise.morpher.sql.core.Dialects;
import com.enterprise.morpher.sql.core.SqlDialect;
import com.enterprise.morpher.sql.param.ParameterBinder;
import com.enterprise.morpher.sql.validation.ExpressionValidator;

import java.util.*;

/**
 * Fluent builder for multi-row INSERT statements.
 *
 * <p>{@code .into(T).columns(C...).valuesOrNull(V...).valuesOrNull(V...).build()}
 *
 * <p>Multi-row output depends on the dialect: a single
 * {@code INSERT INTO t (..) VALUES (..), (..)} where supported, otherwise Oracle
 * {@code INSERT ALL INTO ... SELECT 1 FROM DUAL}. Null values are emitted as the
 * {@code NULL} literal, every other value is a bind parameter.
 *
 * <p>Example:
 * <pre>{@code
 * SqlResult r = InsertBuilder.insert()
 *     .into("new_users")
 *     .columns("id", "username", "phone")
 *     .valuesOrNull(1, "a", "555")
 *     .valuesOrNull(2, "b", null)
 *     .build();
 * }</pre>
 */
public class InsertBuilder {

    private final ParameterBinder binder;
    private SqlDialect dialect = Dialects.ANSI;
    private String table;
    private final List<String> columns = new ArrayList<>();
    private final List<Object[]> rows = new ArrayList<>();

    private InsertBuilder(ParameterBinder binder) {
        this.binder = binder;
    }

    public static InsertBuilder insert() {
        return new InsertBuilder(new ParameterBinder());
    }

    public InsertBuilder dialect(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        return this;
    }

    public InsertBuilder into(String table) {
        ExpressionValidator.validateIdentifier(table);
        this.table = table;
        return this;
    }

    public InsertBuilder columns(String... cols) {
        return columns(Arrays.asList(cols));
    }

    public InsertBuilder columns(List<String> cols) {
        for (String col : cols) {
            ExpressionValidator.validateIdentifier(col);
            columns.add(col);
        }
        return this;
    }

    /**
     * Adds a row of values where nulls are allowed (emitted as NULL literal).
     * Value count must match {@link #columns} count.
     */
    public InsertBuilder valuesOrNull(Object... values) {
        validateValueCount(values);
        rows.add(values.clone());
        return this;
    }

    public SqlResult build() {
        Objects.requireNonNull(table, "table required (call .into(table))");
        if (columns.isEmpty()) {
            throw new IllegalStateException("No columns (call .columns())");
        }
        if (rows.isEmpty()) {
            throw new IllegalStateException("No values (call .valuesOrNull())");
        }
        if (rows.size() == 1 || dialect.supportsMultiRowValues()) {
            return buildValuesList();
        }
        return buildInsertAll();
    }

    // ==================== Internal build methods ====================

    private SqlResult buildValuesList() {
        StringBuilder sql = new StringBuilder();
        sql.append("INSERT INTO ").append(table)
           .append(" (").append(String.join(", ", columns)).append(")")
           .append(" VALUES ");
        List<String> tuples = new ArrayList<>();
        for (Object[] row : rows) {
            tuples.add("(" + String.join(", ", binder.bindRow(columns, row)) + ")");
        }
        sql.append(String.join(", ", tuples));
        return new SqlResult(sql.toString(), binder.getParameters());
    }

    private SqlResult buildInsertAll() {
        String colNames = String.join(", ", columns);
        StringBuilder sql = new StringBuilder("INSERT ALL");
        for (Object[] row : rows) {
            sql.append(" INTO ").append(table)
               .append(" (").append(colNames).append(")")
               .append(" VALUES (").append(String.join(", ", binder.bindRow(columns, row))).append(")");
        }
        sql.append(" SELECT 1 FROM DUAL"); // required by Oracle INSERT ALL syntax
        return new SqlResult(sql.toString(), binder.getParameters());
    }

    // ==================== Helpers ====================

    private void validateValueCount(Object[] values) {
        if (values.length != columns.size()) {
            throw new IllegalArgumentException(
                    "Value count (" + values.length + ") != column count (" + columns.size() + ")");
        }
    }
}
