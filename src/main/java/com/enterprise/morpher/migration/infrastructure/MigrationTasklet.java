package com.enterprise.morpher.migration.infrastructure;

import com.enterprise.morpher.migration.application.MigrationOrchestrator;
import com.enterprise.morpher.migration.domain.CancellationSignal;
import com.enterprise.morpher.migration.domain.CancellationToken;
import com.enterprise.morpher.migration.domain.MigrationReport;
import com.enterprise.morpher.migration.domain.MigrationResult;
import com.enterprise.morpher.migration.domain.MigrationSpec;
import com.enterprise.morpher.migration.domain.TransformRegistry;
import com.enterprise.morpher.shared.querybridge.port.DatabaseConnection;

import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.StoppableTasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.util.List;

/**
 * Runs every configured migration in one tasklet execution and publishes the
 * report to the {@link org.springframework.batch.core.JobExecution} context.
 *
 * <p>Keys written: {@code morpher.rowsWritten}, {@code morpher.summary} and
 * {@code morpher.status.<migration>}. Stopping the job execution cancels the run
 * at the next page or batch boundary: {@code JobOperator.stop} reaches the running
 * tasklet through {@link #stop()}, and a terminate-only flag set on the step
 * execution is honoured as well.
 */
public class MigrationTasklet implements StoppableTasklet {

    public static final ExitStatus COMPLETED_WITH_ERRORS = new ExitStatus("COMPLETED WITH ERRORS");

    private final MigrationOrchestrator orchestrator;
    private final DatabaseConnection source;
    private final DatabaseConnection target;
    private final List<MigrationSpec> migrations;
    private final TransformRegistry registry;
    private volatile CancellationToken stopRequest = new CancellationToken();

    public MigrationTasklet(MigrationOrchestrator orchestrator, DatabaseConnection source,
                            DatabaseConnection target, List<MigrationSpec> migrations,
                            TransformRegistry registry) {
        this.orchestrator = orchestrator;
        this.source = source;
        this.target = target;
        this.migrations = List.copyOf(migrations);
        this.registry = registry;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        StepExecution stepExecution = chunkContext.getStepContext().getStepExecution();
        CancellationToken token = new CancellationToken();
        stopRequest = token;
        CancellationSignal cancellation = () -> token.isCancelled() || stepExecution.isTerminateOnly();
        MigrationReport report = orchestrator.migrate(source, target, migrations, registry, cancellation);

        var ctx = stepExecution.getJobExecution().getExecutionContext();
        ctx.putLong("morpher.rowsWritten", report.totalRowsWritten());
        ctx.putString("morpher.summary", report.summary());
        for (MigrationResult result : report.results()) {
            ctx.putString("morpher.status." + result.name(), result.status().name());
        }
        contribution.incrementWriteCount(report.totalRowsWritten());

        boolean notStarted = report.results().size() < migrations.size();
        if (report.isCancelled() || (notStarted && cancellation.isCancelled())) {
            contribution.setExitStatus(ExitStatus.STOPPED);
        } else if (report.hasErrors()) {
            contribution.setExitStatus(COMPLETED_WITH_ERRORS.addExitDescription(report.summary()));
        }
        return RepeatStatus.FINISHED;
    }

    @Override
    public void stop() {
        stopRequest.cancel();
    }
}
