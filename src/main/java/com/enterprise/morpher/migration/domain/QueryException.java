package com.enterprise.morpher.migration.domain;

/**
 * A source page could not be read after its retry. Fails the current migration only.
 */
public class QueryException extends MigrationException {

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
