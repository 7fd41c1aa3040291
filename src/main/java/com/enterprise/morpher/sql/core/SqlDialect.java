package com.enterprise.morpher.sql.core;

/**
 * The parts of a database's SQL that differ between the engines a migration
 * reads from or writes to.
 */
public interface SqlDialect {

    String name();

    /** Clause appended after ORDER BY to read {@code count} rows after skipping {@code skip}. */
    String page(int count, long skip);

    /** Whether the engine can express this join type at all. */
    boolean supportsJoin(JoinType type);

    /** {@code INSERT INTO t (..) VALUES (..), (..)}; false means Oracle-style INSERT ALL. */
    boolean supportsMultiRowValues();

    UpsertStyle upsertStyle();
}
