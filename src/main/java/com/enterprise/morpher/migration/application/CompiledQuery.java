package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.shared.querybridge.port.PageQueryProvider;
import com.enterprise.morpher.sql.builder.SelectBuilder;
import com.enterprise.morpher.sql.builder.SqlResult;
import com.enterprise.morpher.sql.core.QualifiedColumn;
import com.enterprise.morpher.sql.core.SortDirection;
import com.enterprise.morpher.sql.core.SqlDialect;

import java.util.List;

/**
 * The read query of one migration. Each page is built by a fresh
 * {@link SelectBuilder}; page {@code n} skips {@code n * pageSize} rows, computed
 * as a {@code long}.
 */
public final class CompiledQuery implements PageQueryProvider {

    private final JoinPlan plan;
    private final List<SelectedColumn> columns;
    private final List<QualifiedColumn> orderBy;
    private final int pageSize;
    private final SqlDialect dialect;

    CompiledQuery(JoinPlan plan, List<SelectedColumn> columns, List<QualifiedColumn> orderBy,
                  int pageSize, SqlDialect dialect) {
        this.plan = plan;
        this.columns = List.copyOf(columns);
        this.orderBy = List.copyOf(orderBy);
        this.pageSize = pageSize;
        this.dialect = dialect;
    }

    @Override
    public SqlResult buildQuery(int pageIndex) {
        SelectBuilder select = SelectBuilder.query()
                .dialect(dialect)
                .select(columns.stream().map(SelectedColumn::selectExpression).toArray(String[]::new))
                .from(plan.rootTable());
        plan.joins().forEach(join -> select.join(join.type(), join.table(), join.onClause()));
        orderBy.forEach(column -> select.orderBy(column, SortDirection.ASC));
        if (isPaged()) {
            select.page(pageSize, (long) pageIndex * pageSize);
        }
        return select.build();
    }

    /** Unpaged queries are read in one round trip. */
    public boolean isPaged() {
        return pageSize > 0;
    }

    public int pageSize() {
        return pageSize;
    }

    public List<SelectedColumn> columns() {
        return columns;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    /** A new mapper; mappers cache column positions and are not shared between readers. */
    public SourceRowMapper rowMapper() {
        return new SourceRowMapper(columns);
    }
}
