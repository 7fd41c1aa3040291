package com.enterprise.morpher.migration.domain;

/**
 * Source or target database unreachable. Stops the whole run.
 */
public class ConnectionException extends MigrationException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
