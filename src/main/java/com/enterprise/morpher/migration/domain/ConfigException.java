package com.enterprise.morpher.migration.domain;

/**
 * A migration definition that cannot run. Raised while planning, before any row moves.
 */
public class ConfigException extends MigrationException {

    public enum Reason {
        BROKEN_JOIN_GRAPH,
        DUPLICATE_JOIN_TARGET,
        UNKNOWN_TRANSFORM,
        INVALID_COLUMN_REFERENCE,
        INVALID_EXPRESSION,
        UNSUPPORTED_JOIN_TYPE,
        UNSUPPORTED_WRITE_MODE
    }

    private final Reason reason;

    public ConfigException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ConfigException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /** Same reason, message prefixed with the migration name. */
    public ConfigException inMigration(String migration) {
        return new ConfigException(reason, "Migration '" + migration + "': " + getMessage(), this);
    }
}
