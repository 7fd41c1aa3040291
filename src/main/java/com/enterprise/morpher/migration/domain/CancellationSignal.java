package com.enterprise.morpher.migration.domain;

/**
 * Polled by the engine at page and batch boundaries.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();
}
