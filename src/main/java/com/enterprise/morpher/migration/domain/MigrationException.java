package com.enterprise.morpher.migration.domain;

/**
 * Base of every failure the migration engine raises.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
