package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ErrorStage;
import com.enterprise.morpher.migration.domain.FailurePolicy;
import com.enterprise.morpher.migration.domain.MigrationResult;
import com.enterprise.morpher.migration.domain.MigrationStatus;
import com.enterprise.morpher.migration.domain.RowError;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Counters and errors of one running migration, shared by its reader, processor
 * and writer. Confined to the thread driving the migration.
 */
public class MigrationRunContext {

    private long rowsRead;
    private long rowsTransformed;
    private long rowsFailedTransform;
    private long rowsFiltered;
    private long rowsWritten;
    private long rowsFailedWrite;
    private final List<RowError> errors = new ArrayList<>();

    public void rowRead() {
        rowsRead++;
    }

    public void rowTransformed() {
        rowsTransformed++;
    }

    public void rowFiltered() {
        rowsFiltered++;
    }

    public void transformFailed(RowError error) {
        rowsFailedTransform++;
        errors.add(error);
    }

    public void rowsWritten(int count) {
        rowsWritten += count;
    }

    public void writeFailed(RowError error) {
        rowsFailedWrite++;
        errors.add(error);
    }

    /** Errors not counted against a row: query, connection and policy failures. */
    public void addError(RowError error) {
        errors.add(error);
    }

    public Optional<String> checkPolicy(FailurePolicy policy) {
        return policy.check(
                rowsTransformed + rowsFailedTransform + rowsFiltered, rowsFailedTransform,
                rowsWritten + rowsFailedWrite, rowsFailedWrite);
    }

    public long rowsRead() {
        return rowsRead;
    }

    public long rowsWritten() {
        return rowsWritten;
    }

    public List<RowError> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasErrorsAt(ErrorStage stage) {
        return errors.stream().anyMatch(e -> e.stage() == stage);
    }

    public MigrationResult toResult(String name, MigrationStatus status) {
        return new MigrationResult(name, status, rowsRead, rowsTransformed, rowsFailedTransform,
                rowsFiltered, rowsWritten, rowsFailedWrite, errors);
    }
}
