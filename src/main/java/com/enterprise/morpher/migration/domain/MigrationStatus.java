package com.enterprise.morpher.migration.domain;

public enum MigrationStatus {
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    FAILED,
    CANCELLED
}
