package com.enterprise.morpher.shared.querybridge.adapter;

import com.enterprise.morpher.shared.querybridge.port.DatabaseConnection;
import com.enterprise.morpher.sql.builder.SqlResult;
import com.enterprise.morpher.sql.core.Dialects;
import com.enterprise.morpher.sql.core.SqlDialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link DatabaseConnection} over a JDBC {@link DataSource}.
 *
 * <p>Reads and writes go through a {@link NamedParameterJdbcTemplate}, so the DSL's
 * {@code :name} parameters are used as-is. Transactions use a
 * {@link DataSourceTransactionManager} on the same DataSource: statements issued
 * inside {@link #inTransaction} share its connection.
 *
 * <pre>{@code
 * DatabaseConnection source = new JdbcDatabaseConnection("source", sourceDataSource);
 * source.dialect(); // detected from DatabaseMetaData on first use
 * }</pre>
 */
public class JdbcDatabaseConnection implements DatabaseConnection {

    private static final Logger log = LoggerFactory.getLogger(JdbcDatabaseConnection.class);

    private final String name;
    private final DataSource dataSource;
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private volatile SqlDialect dialect;

    public JdbcDatabaseConnection(String name, DataSource dataSource) {
        this(name, dataSource, null);
    }

    /**
     * @param dialect fixed dialect, or {@code null} to detect it from the database
     */
    public JdbcDatabaseConnection(String name, DataSource dataSource, SqlDialect dialect) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.dialect = dialect;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SqlDialect dialect() {
        SqlDialect detected = dialect;
        if (detected == null) {
            String product = extractMetaData(DatabaseMetaData::getDatabaseProductName);
            detected = Dialects.forProductName(product);
            log.debug("Connection '{}' is {} -> {} dialect", name, product, detected.name());
            dialect = detected;
        }
        return detected;
    }

    @Override
    public <T> List<T> query(SqlResult query, RowMapper<T> rowMapper) {
        return jdbc.query(query.sql(), query.namedParameters(), rowMapper);
    }

    @Override
    public int update(SqlResult statement) {
        return jdbc.update(statement.sql(), statement.namedParameters());
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    @Override
    public Set<String> columnNames(String table) {
        return extractMetaData(meta -> {
            // unquoted identifiers are stored upper case by some engines, lower case by others
            for (String candidate : new LinkedHashSet<>(List.of(
                    table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT)))) {
                Set<String> columns = readColumns(meta, candidate);
                if (!columns.isEmpty()) {
                    return columns;
                }
            }
            return Set.of();
        });
    }

    private static Set<String> readColumns(DatabaseMetaData meta, String table) throws SQLException {
        String schema = null;
        String tableName = table;
        int dot = table.lastIndexOf('.');
        if (dot > 0) {
            schema = table.substring(0, dot);
            tableName = table.substring(dot + 1);
        }
        Set<String> columns = new LinkedHashSet<>();
        try (ResultSet rs = meta.getColumns(null, schema, tableName, null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME"));
            }
        }
        return columns;
    }

    private <T> T extractMetaData(MetaDataReader<T> reader) {
        try {
            return JdbcUtils.extractDatabaseMetaData(dataSource, reader::read);
        } catch (MetaDataAccessException e) {
            throw new DataAccessResourceFailureException(
                    "Cannot read metadata of connection '" + name + "'", e);
        }
    }

    @FunctionalInterface
    private interface MetaDataReader<T> {
        T read(DatabaseMetaData meta) throws SQLException;
    }
}
