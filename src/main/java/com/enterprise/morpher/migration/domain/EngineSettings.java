package com.enterprise.morpher.migration.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of one engine run.
 *
 * @param pageSize       rows per source page; {@code <= 0} reads everything in one query
 * @param batchSize      rows per write transaction
 * @param retryDelay     fixed wait before the single retry of a page read or batch write
 * @param prefetchPages  pages read ahead on a background thread; 0 disables prefetch
 * @param validateSchema check tables and columns against source metadata while planning
 */
public record EngineSettings(
        int pageSize,
        int batchSize,
        Duration retryDelay,
        int prefetchPages,
        FailurePolicy failurePolicy,
        boolean validateSchema) {

    public static final int DEFAULT_PAGE_SIZE = 500;
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(200);

    public EngineSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (prefetchPages < 0) {
            throw new IllegalArgumentException("prefetchPages must not be negative: " + prefetchPages);
        }
        retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY : retryDelay;
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
        }
        failurePolicy = Objects.requireNonNullElse(failurePolicy, FailurePolicy.BEST_EFFORT);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_PAGE_SIZE, DEFAULT_BATCH_SIZE, DEFAULT_RETRY_DELAY,
                0, FailurePolicy.BEST_EFFORT, true);
    }

    public EngineSettings withPageSize(int pageSize) {
        return new EngineSettings(pageSize, batchSize, retryDelay, prefetchPages, failurePolicy, validateSchema);
    }

    public EngineSettings withBatchSize(int batchSize) {
        return new EngineSettings(pageSize, batchSize, retryDelay, prefetchPages, failurePolicy, validateSchema);
    }

    public EngineSettings withRetryDelay(Duration retryDelay) {
        return new EngineSettings(pageSize, batchSize, retryDelay, prefetchPages, failurePolicy, validateSchema);
    }

    public EngineSettings withPrefetchPages(int prefetchPages) {
        return new EngineSettings(pageSize, batchSize, retryDelay, prefetchPages, failurePolicy, validateSchema);
    }

    public EngineSettings withFailurePolicy(FailurePolicy failurePolicy) {
        return new EngineSettings(pageSize, batchSize, retryDelay, prefetchPages, failurePolicy, validateSchema);
    }

    public EngineSettings withValidateSchema(boolean validateSchema) {
        return new EngineSettings(pageSize, batchSize, retryDelay, prefetchPages, failurePolicy, validateSchema);
    }
}
