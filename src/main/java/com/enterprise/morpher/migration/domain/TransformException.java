package com.enterprise.morpher.migration.domain;

/**
 * A single row could not be transformed. Recorded against the row, never propagated
 * out of the pipeline.
 */
public class TransformException extends MigrationException {

    private final String rowIdentifier;

    public TransformException(String rowIdentifier, String message) {
        super(message);
        this.rowIdentifier = rowIdentifier;
    }

    public TransformException(String rowIdentifier, String message, Throwable cause) {
        super(message, cause);
        this.rowIdentifier = rowIdentifier;
    }

    public String rowIdentifier() {
        return rowIdentifier;
    }
}
