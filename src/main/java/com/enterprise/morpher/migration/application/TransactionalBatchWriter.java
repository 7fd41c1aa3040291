package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ConnectionException;
import com.enterprise.morpher.migration.domain.ErrorStage;
import com.enterprise.morpher.migration.domain.RowError;
import com.enterprise.morpher.migration.domain.TargetRow;
import com.enterprise.morpher.migration.domain.WriteMode;
import com.enterprise.morpher.shared.querybridge.adapter.DataAccessErrors;
import com.enterprise.morpher.shared.querybridge.port.DatabaseConnection;
import com.enterprise.morpher.sql.builder.InsertBuilder;
import com.enterprise.morpher.sql.builder.SqlResult;
import com.enterprise.morpher.sql.builder.UpsertBuilder;
import com.enterprise.morpher.sql.debug.QueryDebugger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Writes each chunk as one multi-row statement in one target transaction.
 *
 * <p>A failed batch is rolled back and retried once after the retry delay. When the
 * retry fails too, every row of the batch is recorded as a {@code WRITE} error and
 * the writer carries on with the next batch, unless the target connection is gone,
 * which raises {@link ConnectionException}. Batches are written in the order given.
 * In UPSERT mode a batch whose rows repeat a key is sent as several statements in
 * the same transaction.
 */
public class TransactionalBatchWriter implements ItemWriter<TargetRow> {

    private static final Logger log = LoggerFactory.getLogger(TransactionalBatchWriter.class);

    private final DatabaseConnection target;
    private final String table;
    private final List<String> columns;
    private final WriteMode writeMode;
    private final List<String> keyColumns;
    private final Duration retryDelay;
    private final MigrationRunContext context;
    private int batchNumber;

    public TransactionalBatchWriter(DatabaseConnection target, String table, List<String> columns,
                                    WriteMode writeMode, List<String> keyColumns,
                                    Duration retryDelay, MigrationRunContext context) {
        this.target = Objects.requireNonNull(target, "target");
        this.table = Objects.requireNonNull(table, "table");
        this.columns = List.copyOf(columns);
        this.writeMode = Objects.requireNonNull(writeMode, "writeMode");
        this.keyColumns = List.copyOf(keyColumns);
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Splits {@code rows} into batches of {@code batchSize} and writes them in order.
     */
    public void writeAll(List<TargetRow> rows, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        for (int from = 0; from < rows.size(); from += batchSize) {
            write(new Chunk<>(rows.subList(from, Math.min(from + batchSize, rows.size()))));
        }
    }

    @Override
    public void write(Chunk<? extends TargetRow> chunk) {
        if (chunk.isEmpty()) {
            return;
        }
        batchNumber++;
        List<TargetRow> rows = new ArrayList<>(chunk.getItems());
        List<SqlResult> statements = buildStatements(rows);
        try {
            execute(statements);
        } catch (DataAccessException | TransactionException first) {
            log.warn("Batch {} of {} rows into '{}' failed, retrying in {} ms: {}", batchNumber, rows.size(),
                    table, retryDelay.toMillis(), DataAccessErrors.rootMessage(first));
            RetryPause.sleep(retryDelay);
            try {
                execute(statements);
            } catch (DataAccessException | TransactionException second) {
                if (log.isDebugEnabled()) {
                    statements.forEach(statement -> log.debug("{}", QueryDebugger.format(
                            "failed batch " + batchNumber + " into '" + table + "'", statement)));
                }
                failBatch(rows, second);
                return;
            }
        }
        context.rowsWritten(rows.size());
        log.debug("Batch {} committed: {} rows into '{}'", batchNumber, rows.size(), table);
    }

    private void execute(List<SqlResult> statements) {
        target.inTransaction(() -> {
            int updated = 0;
            for (SqlResult statement : statements) {
                updated += target.update(statement);
            }
            return updated;
        });
    }

    private void failBatch(List<TargetRow> rows, RuntimeException error) {
        String message = DataAccessErrors.rootMessage(error);
        if (DataAccessErrors.isConnectionFailure(error)) {
            throw new ConnectionException("Target '" + target.name() + "' unreachable while writing batch "
                    + batchNumber + " into '" + table + "': " + message, error);
        }
        log.warn("Batch {} into '{}' failed after retry, {} rows rejected: {}", batchNumber, table,
                rows.size(), message);
        for (TargetRow row : rows) {
            context.writeFailed(new RowError(ErrorStage.WRITE, row.identifier(), message));
        }
    }

    /**
     * The statements of one batch, executed in order in one transaction. An upsert
     * statement may not touch the same target row twice (PostgreSQL ON CONFLICT,
     * SQL MERGE), so in UPSERT mode a row whose key already occurs in the current
     * statement starts the next one. Every row is written, in read order.
     */
    List<SqlResult> buildStatements(List<TargetRow> rows) {
        if (writeMode != WriteMode.UPSERT) {
            return List.of(buildStatement(rows));
        }
        List<SqlResult> statements = new ArrayList<>();
        List<TargetRow> segment = new ArrayList<>();
        Set<List<Object>> keys = new HashSet<>();
        for (TargetRow row : rows) {
            if (!keys.add(keyOf(row))) {
                statements.add(buildStatement(segment));
                segment = new ArrayList<>();
                keys.clear();
                keys.add(keyOf(row));
            }
            segment.add(row);
        }
        statements.add(buildStatement(segment));
        if (statements.size() > 1) {
            log.debug("Batch {} into '{}' repeats keys, split into {} statements", batchNumber, table,
                    statements.size());
        }
        return statements;
    }

    SqlResult buildStatement(List<TargetRow> rows) {
        if (writeMode == WriteMode.UPSERT) {
            UpsertBuilder upsert = UpsertBuilder.upsert(target.dialect().upsertStyle())
                    .into(table)
                    .columns(columns)
                    .keys(keyColumns);
            rows.forEach(row -> upsert.valuesOrNull(valuesOf(row)));
            return upsert.build();
        }
        InsertBuilder insert = InsertBuilder.insert()
                .dialect(target.dialect())
                .into(table)
                .columns(columns);
        rows.forEach(row -> insert.valuesOrNull(valuesOf(row)));
        return insert.build();
    }

    private List<Object> keyOf(TargetRow row) {
        List<Object> key = new ArrayList<>(keyColumns.size());
        keyColumns.forEach(column -> key.add(row.valueOf(column)));
        return key;
    }

    private Object[] valuesOf(TargetRow row) {
        Object[] values = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            values[i] = row.valueOf(columns.get(i));
        }
        return values;
    }
}
