package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.CancellationSignal;
import com.enterprise.morpher.migration.domain.ConfigException;
import com.enterprise.morpher.migration.domain.ConnectionException;
import com.enterprise.morpher.migration.domain.EngineSettings;
import com.enterprise.morpher.migration.domain.ErrorStage;
import com.enterprise.morpher.migration.domain.MigrationReport;
import com.enterprise.morpher.migration.domain.MigrationResult;
import com.enterprise.morpher.migration.domain.MigrationSpec;
import com.enterprise.morpher.migration.domain.MigrationStatus;
import com.enterprise.morpher.migration.domain.QueryException;
import com.enterprise.morpher.migration.domain.RowError;
import com.enterprise.morpher.migration.domain.SourceRow;
import com.enterprise.morpher.migration.domain.TargetRow;
import com.enterprise.morpher.migration.domain.TransformRegistry;
import com.enterprise.morpher.shared.querybridge.adapter.DataAccessErrors;
import com.enterprise.morpher.shared.querybridge.port.DatabaseConnection;
import com.enterprise.morpher.sql.core.SqlDialect;
import com.enterprise.morpher.sql.debug.QueryDebugger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs a list of migrations from a source to a target connection.
 *
 * <p>All migrations are planned before the first row moves; a {@link ConfigException}
 * in any of them fails the run. Migrations then run one after another in declared
 * order, each as read (paged) → transform → write (batched). A {@link QueryException}
 * fails the current migration and the run goes on; a {@link ConnectionException}
 * fails it and stops the run. Any other exception fails the current migration as an
 * {@code INTERNAL} error. Either way the report lists every migration attempted.
 *
 * <pre>{@code
 * MigrationReport report = new MigrationOrchestrator(EngineSettings.defaults())
 *     .migrate(source, target, List.of(users, orders), registry);
 * }</pre>
 */
public class MigrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MigrationOrchestrator.class);

    private final EngineSettings settings;
    private final MigrationPlanner planner;

    public MigrationOrchestrator(EngineSettings settings) {
        this(settings, new MigrationPlanner());
    }

    public MigrationOrchestrator(EngineSettings settings, MigrationPlanner planner) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.planner = Objects.requireNonNull(planner, "planner");
    }

    public EngineSettings settings() {
        return settings;
    }

    public MigrationReport migrate(DatabaseConnection source, DatabaseConnection target,
                                   List<MigrationSpec> migrations, TransformRegistry registry) {
        return migrate(source, target, migrations, registry, CancellationSignal.NONE);
    }

    /**
     * @throws ConfigException     if any migration cannot run; nothing has been written
     * @throws ConnectionException if a database is unreachable while planning
     */
    public MigrationReport migrate(DatabaseConnection source, DatabaseConnection target,
                                   List<MigrationSpec> migrations, TransformRegistry registry,
                                   CancellationSignal cancellation) {
        List<MigrationPlan> plans = planAll(source, target, migrations, registry);
        log.info("Planned {} migrations from '{}' to '{}'", plans.size(), source.name(), target.name());

        List<MigrationResult> results = new ArrayList<>();
        for (MigrationPlan plan : plans) {
            if (cancellation.isCancelled()) {
                log.info("Run cancelled, {} migrations not started", plans.size() - results.size());
                break;
            }
            MigrationRun run = run(plan, source, target, cancellation);
            results.add(run.result());
            if (run.stopsRun()) {
                log.error("Stopping run after migration '{}': connection lost", plan.name());
                break;
            }
            if (run.result().status() == MigrationStatus.CANCELLED) {
                break;
            }
        }
        MigrationReport report = new MigrationReport(results);
        log.info("Run finished: {} of {} migrations attempted, {} rows written",
                results.size(), plans.size(), report.totalRowsWritten());
        return report;
    }

    /**
     * Validates every migration against the connections without moving data.
     */
    public List<MigrationPlan> planAll(DatabaseConnection source, DatabaseConnection target,
                                       List<MigrationSpec> migrations, TransformRegistry registry) {
        try {
            SqlDialect sourceDialect = source.dialect();
            SqlDialect targetDialect = target.dialect();
            Function<String, Set<String>> schema = settings.validateSchema() ? source::columnNames : null;
            List<MigrationPlan> plans = new ArrayList<>();
            for (MigrationSpec spec : migrations) {
                plans.add(planner.plan(spec, registry, settings.pageSize(), sourceDialect, targetDialect, schema));
            }
            return plans;
        } catch (DataAccessException e) {
            throw new ConnectionException("Cannot read database metadata while planning: "
                    + DataAccessErrors.rootMessage(e), e);
        }
    }

    private MigrationRun run(MigrationPlan plan, DatabaseConnection source, DatabaseConnection target,
                             CancellationSignal cancellation) {
        MigrationSpec spec = plan.spec();
        log.info("Migration '{}' started: {} -> {}", spec.name(), spec.rootTable(), spec.targetTable());
        if (!plan.joinPlan().outerJoinedTables().isEmpty()) {
            log.debug("Migration '{}' outer joins {}; unmatched columns are read as null", spec.name(),
                    plan.joinPlan().outerJoinedTables());
        }
        if (log.isDebugEnabled()) {
            log.debug("{}", QueryDebugger.format("read for '" + spec.name() + "'", plan.query().buildQuery(0)));
        }

        MigrationRunContext context = new MigrationRunContext();
        PageSource pages = new JdbcPageSource(source, plan.query(), settings.retryDelay());
        if (settings.prefetchPages() > 0) {
            pages = new PrefetchingPageSource(pages, settings.prefetchPages(), spec.name());
        }
        PagedRowReader reader = new PagedRowReader(pages, cancellation, context);
        RowTransformProcessor processor = new RowTransformProcessor(plan.columnMapping(), plan.transform(), context);
        TransactionalBatchWriter writer = new TransactionalBatchWriter(target, spec.targetTable(),
                spec.targetColumns(), spec.writeMode(), spec.keyColumns(), settings.retryDelay(), context);

        MigrationStatus status;
        boolean stopsRun = false;
        reader.open(new ExecutionContext());
        try {
            status = pump(reader, processor, writer, context, cancellation);
        } catch (QueryException e) {
            log.error("Migration '{}' failed: {}", spec.name(), e.getMessage());
            context.addError(new RowError(ErrorStage.QUERY, spec.rootTable(), e.getMessage()));
            status = MigrationStatus.FAILED;
        } catch (ConnectionException e) {
            log.error("Migration '{}' failed: {}", spec.name(), e.getMessage());
            context.addError(new RowError(ErrorStage.CONNECTION, spec.name(), e.getMessage()));
            status = MigrationStatus.FAILED;
            stopsRun = true;
        } catch (RuntimeException e) {
            log.error("Migration '{}' failed unexpectedly", spec.name(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            context.addError(new RowError(ErrorStage.INTERNAL, spec.name(), message));
            status = MigrationStatus.FAILED;
        } finally {
            reader.close();
        }

        MigrationResult result = context.toResult(spec.name(), status);
        log.info("Migration '{}' finished: {}", spec.name(), result.summary());
        return new MigrationRun(result, stopsRun);
    }

    private MigrationStatus pump(PagedRowReader reader, RowTransformProcessor processor,
                                 TransactionalBatchWriter writer, MigrationRunContext context,
                                 CancellationSignal cancellation) {
        int batch = 0;
        boolean drained = false;
        while (!drained) {
            if (cancellation.isCancelled()) {
                return MigrationStatus.CANCELLED;
            }
            List<TargetRow> rows = new ArrayList<>();
            while (rows.size() < settings.batchSize()) {
                SourceRow row = reader.read();
                if (row == null) {
                    drained = true;
                    break;
                }
                TargetRow out = processor.process(row);
                if (out != null) {
                    rows.add(out);
                }
            }
            writer.write(new Chunk<>(rows));
            batch++;

            Optional<String> violation = context.checkPolicy(settings.failurePolicy());
            if (violation.isPresent()) {
                log.error("Aborting after batch {}: {}", batch, violation.get());
                context.addError(new RowError(ErrorStage.POLICY, "batch " + batch, violation.get()));
                return MigrationStatus.FAILED;
            }
        }
        if (reader.wasCancelled()) {
            return MigrationStatus.CANCELLED;
        }
        return context.hasErrors() ? MigrationStatus.COMPLETED_WITH_ERRORS : MigrationStatus.COMPLETED;
    }

    private record MigrationRun(MigrationResult result, boolean stopsRun) {
    }
}
