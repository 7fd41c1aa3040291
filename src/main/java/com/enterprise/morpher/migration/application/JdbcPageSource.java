package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ConnectionException;
import com.enterprise.morpher.migration.domain.QueryException;
import com.enterprise.morpher.migration.domain.SourceRow;
import com.enterprise.morpher.shared.querybridge.adapter.DataAccessErrors;
import com.enterprise.morpher.shared.querybridge.port.DatabaseConnection;
import com.enterprise.morpher.sql.builder.SqlResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reads a {@link CompiledQuery} page by page from a {@link DatabaseConnection}.
 *
 * <p>A failed page is retried once after the retry delay. A second failure raises
 * {@link ConnectionException} when the connection itself is gone, otherwise
 * {@link QueryException}. A page shorter than the page size ends the read.
 */
public class JdbcPageSource implements PageSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcPageSource.class);

    private final DatabaseConnection source;
    private final CompiledQuery query;
    private final SourceRowMapper rowMapper;
    private final Duration retryDelay;
    private int pageIndex;
    private boolean exhausted;

    public JdbcPageSource(DatabaseConnection source, CompiledQuery query, Duration retryDelay) {
        this.source = Objects.requireNonNull(source, "source");
        this.query = Objects.requireNonNull(query, "query");
        this.rowMapper = query.rowMapper();
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
    }

    @Override
    public List<SourceRow> nextPage() {
        if (exhausted) {
            return null;
        }
        SqlResult page = query.buildQuery(pageIndex);
        List<SourceRow> rows = readWithRetry(page);
        if (!query.isPaged() || rows.size() < query.pageSize()) {
            exhausted = true;
        }
        pageIndex++;
        return rows;
    }

    private List<SourceRow> readWithRetry(SqlResult page) {
        try {
            return source.query(page, rowMapper);
        } catch (DataAccessException first) {
            log.warn("Page {} from '{}' failed, retrying in {} ms: {}", pageIndex, source.name(),
                    retryDelay.toMillis(), DataAccessErrors.rootMessage(first));
            RetryPause.sleep(retryDelay);
            try {
                return source.query(page, rowMapper);
            } catch (DataAccessException second) {
                String message = "Page " + pageIndex + " from '" + source.name() + "' failed after retry: "
                        + DataAccessErrors.rootMessage(second);
                if (DataAccessErrors.isConnectionFailure(second)) {
                    throw new ConnectionException(message, second);
                }
                throw new QueryException(message, second);
            }
        }
    }
}
