package com.enterprise.morpher.migration.domain;

public enum WriteMode {
    /** Plain multi-row INSERT. Re-running a migration duplicates rows. */
    INSERT,
    /** Dialect upsert matched on the migration's key columns. */
    UPSERT
}
