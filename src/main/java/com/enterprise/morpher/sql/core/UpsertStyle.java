package com.enterprise.morpher.sql.core;

/**
 * How a dialect expresses "insert, or update when the key already exists".
 */
public enum UpsertStyle {
    /** No upsert statement available. */
    NONE,
    /** H2: {@code MERGE INTO t (cols) KEY (keys) VALUES ...} */
    MERGE_KEY,
    /** PostgreSQL / SQLite: {@code INSERT ... ON CONFLICT (keys) DO UPDATE SET ...} */
    ON_CONFLICT,
    /** MySQL / MariaDB: {@code INSERT ... ON DUPLICATE KEY UPDATE ...} */
    ON_DUPLICATE_KEY
}
