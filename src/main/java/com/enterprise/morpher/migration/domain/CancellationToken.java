package com.enterprise.morpher.migration.domain;

import java.util.concurrent.atomic.AtomicBoolean;

public final class CancellationToken implements CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }
}
