package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.MigrationException;

import java.time.Duration;

final class RetryPause {

    private RetryPause() {}

    static void sleep(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationException("Interrupted while waiting to retry", e);
        }
    }
}
