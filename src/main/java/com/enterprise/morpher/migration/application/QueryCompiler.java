package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ConfigException;
import com.enterprise.morpher.migration.domain.ConfigException.Reason;
import com.enterprise.morpher.migration.domain.JoinSpec;
import com.enterprise.morpher.sql.core.QualifiedColumn;
import com.enterprise.morpher.sql.core.SqlDialect;
import com.enterprise.morpher.sql.validation.ExpressionValidator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Compiles a join plan and the mapped source columns into a paged SELECT.
 *
 * <pre>
 * SELECT users.id AS c1_id, profiles.phone AS c2_phone
 * FROM users LEFT JOIN profiles ON users.id = profiles.user_id
 * ORDER BY users.id ASC, profiles.phone ASC OFFSET 0 ROWS FETCH NEXT 500 ROWS ONLY
 * </pre>
 */
public class QueryCompiler {

    /**
     * Orders pages by the first selected column.
     */
    public CompiledQuery compile(JoinPlan plan, List<QualifiedColumn> columns, int pageSize,
                                 SqlDialect dialect) {
        return compile(plan, columns, List.of(), pageSize, dialect);
    }

    /**
     * @param orderBy   leading page ordering; empty means the first selected column.
     *                  The remaining selected columns are always appended.
     * @param pageSize  rows per page, {@code <= 0} for a single unpaged read
     * @throws ConfigException {@code UNSUPPORTED_JOIN_TYPE} when the dialect cannot express a join,
     *                         {@code INVALID_COLUMN_REFERENCE} for columns outside the plan
     */
    public CompiledQuery compile(JoinPlan plan, List<QualifiedColumn> columns,
                                 List<QualifiedColumn> orderBy, int pageSize, SqlDialect dialect) {
        if (columns.isEmpty()) {
            throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE, "No source columns to select");
        }
        for (JoinSpec join : plan.joins()) {
            if (!dialect.supportsJoin(join.type())) {
                throw new ConfigException(Reason.UNSUPPORTED_JOIN_TYPE,
                        join.type().sql() + " of '" + join.table() + "' is not supported by "
                                + dialect.name());
            }
        }
        List<SelectedColumn> selected = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            QualifiedColumn column = columns.get(i);
            checkReference(plan, column);
            selected.add(SelectedColumn.at(i + 1, column));
        }
        orderBy.forEach(column -> checkReference(plan, column));
        List<QualifiedColumn> ordering = pageOrdering(columns, orderBy);

        CompiledQuery query = new CompiledQuery(plan, selected, ordering, pageSize, dialect);
        try {
            query.buildQuery(0);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ConfigException(Reason.INVALID_EXPRESSION,
                    "Cannot build query over " + plan.tables() + ": " + e.getMessage(), e);
        }
        return query;
    }

    /**
     * The declared order (or the first selected column), followed by every other
     * selected column. A join fan-out repeats the leading key, and OFFSET paging
     * over tied keys may return the tied rows in a different order for each page.
     */
    static List<QualifiedColumn> pageOrdering(List<QualifiedColumn> columns, List<QualifiedColumn> orderBy) {
        List<QualifiedColumn> ordering = new ArrayList<>(orderBy.isEmpty() ? List.of(columns.get(0)) : orderBy);
        Set<String> seen = new HashSet<>();
        ordering.forEach(column -> seen.add(column.ref().toLowerCase(Locale.ROOT)));
        for (QualifiedColumn column : columns) {
            if (seen.add(column.ref().toLowerCase(Locale.ROOT))) {
                ordering.add(column);
            }
        }
        return ordering;
    }

    private static void checkReference(JoinPlan plan, QualifiedColumn column) {
        try {
            ExpressionValidator.validateIdentifier(column.ref());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE, e.getMessage(), e);
        }
        if (!plan.contains(column.table())) {
            throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE,
                    "Column '" + column + "' references table '" + column.table()
                            + "', which is neither the root nor joined: " + plan.tables());
        }
    }
}
