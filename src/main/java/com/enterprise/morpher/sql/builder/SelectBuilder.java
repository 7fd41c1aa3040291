package com.enterprise.morpher.sql.builder;

import com.enterprise.morpher.sql.core.Dialects;
import com.enterprise.morpher.sql.core.JoinType;
import com.enterprise.morpher.sql.core.QualifiedColumn;
import com.enterprise.morpher.sql.core.SortDirection;
import com.enterprise.morpher.sql.core.SqlDialect;
import com.enterprise.morpher.sql.validation.ExpressionValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the read side of a migration: one SELECT over a root table and an
 * ordered list of joins, optionally restricted to one page. Paging values are
 * inlined, so the {@link SqlResult} carries no parameters.
 *
 * <p>Unsupported: WHERE / GROUP BY / HAVING, subqueries, CTEs, table aliases.
 * The join order in the emitted SQL is exactly the order of the
 * {@link #join} calls.
 *
 * <p>Example:
 * <pre>{@code
 * SqlResult page = SelectBuilder.query()
 *     .dialect(Dialects.POSTGRESQL)
 *     .select("users.id AS c1_id", "profiles.phone AS c2_phone")
 *     .from("users")
 *     .join(JoinType.LEFT, "profiles", "users.id = profiles.user_id")
 *     .orderBy(QualifiedColumn.parse("users.id"), SortDirection.ASC)
 *     .page(500, 1000)
 *     .build();
 * }</pre>
 */
public class SelectBuilder {

    private SqlDialect dialect = Dialects.ANSI;
    private final List<String> selectColumns = new ArrayList<>();
    private String fromClause;
    private final List<String> joins = new ArrayList<>();
    private final List<String> orderByClauses = new ArrayList<>();
    private String pageClause;

    private SelectBuilder() {}

    public static SelectBuilder query() {
        return new SelectBuilder();
    }

    public SelectBuilder dialect(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect);
        return this;
    }

    /**
     * @param columns select-list entries such as {@code users.id AS c1_id}
     */
    public SelectBuilder select(String... columns) {
        for (String column : columns) {
            ExpressionValidator.validateExpression(column);
            selectColumns.add(column);
        }
        return this;
    }

    public SelectBuilder from(String table) {
        ExpressionValidator.validateIdentifier(table);
        this.fromClause = table;
        return this;
    }

    /**
     * Joins a table with a raw ON predicate.
     *
     * @throws IllegalStateException if the dialect cannot express the join type
     */
    public SelectBuilder join(JoinType type, String table, String onClause) {
        ExpressionValidator.validateIdentifier(table);
        ExpressionValidator.validateExpression(onClause);
        if (!dialect.supportsJoin(type)) {
            throw new IllegalStateException(type.sql() + " is not supported by " + dialect.name());
        }
        joins.add(type.clause(table, onClause));
        return this;
    }

    public SelectBuilder orderBy(QualifiedColumn column, SortDirection dir) {
        orderByClauses.add(column.ref() + " " + dir.name());
        return this;
    }

    /**
     * Restricts the result to {@code size} rows after skipping {@code skip}.
     * Needs an ORDER BY, otherwise pages are not stable.
     */
    public SelectBuilder page(int size, long skip) {
        if (size <= 0 || skip < 0) {
            throw new IllegalArgumentException("Invalid page: size " + size + ", skip " + skip);
        }
        this.pageClause = dialect.page(size, skip);
        return this;
    }

    public SqlResult build() {
        if (selectColumns.isEmpty()) {
            throw new IllegalStateException("No columns (call .select())");
        }
        Objects.requireNonNull(fromClause, "FROM required (call .from(table))");
        if (pageClause != null && orderByClauses.isEmpty()) {
            throw new IllegalStateException("Paged query without ORDER BY");
        }

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", selectColumns))
                .append(" FROM ").append(fromClause);
        joins.forEach(join -> sql.append(' ').append(join));
        if (!orderByClauses.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderByClauses));
        }
        if (pageClause != null) {
            sql.append(' ').append(pageClause);
        }

        SqlResult result = new SqlResult(sql.toString(), Map.of());
        result.verify();
        return result;
    }
}
