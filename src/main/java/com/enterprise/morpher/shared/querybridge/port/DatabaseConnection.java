package com.enterprise.morpher.shared.querybridge.port;

import com.enterprise.morpher.sql.builder.SqlResult;
import com.enterprise.morpher.sql.core.SqlDialect;

import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The capability a migration needs from a source or target database.
 *
 * <p>Implementations are handed to the engine already configured; the engine
 * never opens or closes the underlying connections. Failures surface as Spring
 * {@link org.springframework.dao.DataAccessException}s.
 */
public interface DatabaseConnection {

    /** Short name used in logs ("source", "target"). */
    String name();

    SqlDialect dialect();

    /**
     * Executes a parameterized read query.
     */
    <T> List<T> query(SqlResult query, RowMapper<T> rowMapper);

    /**
     * Executes a parameterized write, joining the current transaction if any.
     *
     * @return the driver-reported update count
     */
    int update(SqlResult statement);

    /**
     * Runs {@code work} in one transaction: commit when it returns, rollback
     * when it throws.
     */
    <T> T inTransaction(Supplier<T> work);

    /**
     * Column names of a table, or an empty set when the table does not exist.
     */
    Set<String> columnNames(String table);
}
