package com.enterprise.morpher.migration.domain;

public enum ErrorStage {
    QUERY,
    TRANSFORM,
    WRITE,
    CONNECTION,
    /** Failure policy threshold exceeded. */
    POLICY,
    /** Unexpected failure inside the engine; fails the migration, the run goes on. */
    INTERNAL
}
