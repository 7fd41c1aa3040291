package com.enterprise.morpher.migration.domain;

/**
 * @param rowIdentifier {@code column=value} of the row's first mapped column, or a
 *                      batch/page marker for errors not tied to one row
 */
public record RowError(ErrorStage stage, String rowIdentifier, String message) {

    @Override
    public String toString() {
        return stage + " [" + rowIdentifier + "] " + message;
    }
}
