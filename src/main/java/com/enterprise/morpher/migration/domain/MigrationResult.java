package com.enterprise.morpher.migration.domain;

import java.util.List;

/**
 * Outcome of one migration. Every failed row appears in {@code errors}.
 */
public record MigrationResult(
        String name,
        MigrationStatus status,
        long rowsRead,
        long rowsTransformed,
        long rowsFailedTransform,
        long rowsFiltered,
        long rowsWritten,
        long rowsFailedWrite,
        List<RowError> errors) {

    public MigrationResult {
        errors = List.copyOf(errors);
    }

    public List<RowError> errorsAt(ErrorStage stage) {
        return errors.stream().filter(e -> e.stage() == stage).toList();
    }

    public String summary() {
        return String.format("%s: %s read=%d transformed=%d failedTransform=%d filtered=%d written=%d failedWrite=%d",
                name, status, rowsRead, rowsTransformed, rowsFailedTransform,
                rowsFiltered, rowsWritten, rowsFailedWrite);
    }
}
