package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.MigrationException;
import com.enterprise.morpher.migration.domain.SourceRow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Reads pages of a delegate on one background thread, at most {@code depth} pages
 * ahead of the consumer. Pages are handed over in read order; a failure of the
 * delegate is rethrown to the consumer after the pages read before it.
 */
public class PrefetchingPageSource implements PageSource {

    private static final Logger log = LoggerFactory.getLogger(PrefetchingPageSource.class);

    private final PageSource delegate;
    private final BlockingQueue<Fetched> queue;
    private final ExecutorService executor;
    private boolean finished;

    public PrefetchingPageSource(PageSource delegate, int depth, String name) {
        if (depth <= 0) {
            throw new IllegalArgumentException("Prefetch depth must be positive: " + depth);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.queue = new ArrayBlockingQueue<>(depth);
        this.executor = Executors.newSingleThreadExecutor(
                new CustomizableThreadFactory("morpher-prefetch-" + name + "-"));
        executor.execute(this::fetchAll);
    }

    @Override
    public List<SourceRow> nextPage() {
        if (finished) {
            return null;
        }
        Fetched next;
        try {
            next = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationException("Interrupted while waiting for the next page", e);
        }
        if (next.failure() != null) {
            finished = true;
            throw next.failure();
        }
        if (next.rows() == null) {
            finished = true;
        }
        return next.rows();
    }

    @Override
    public void close() {
        finished = true;
        executor.shutdownNow();
        delegate.close();
    }

    private void fetchAll() {
        try {
            List<SourceRow> rows;
            do {
                try {
                    rows = delegate.nextPage();
                } catch (RuntimeException e) {
                    queue.put(new Fetched(null, e));
                    return;
                }
                queue.put(new Fetched(rows, null));
            } while (rows != null);
        } catch (InterruptedException e) {
            log.debug("Prefetch stopped before the source was exhausted");
            Thread.currentThread().interrupt();
        }
    }

    /** A page, the end marker ({@code rows == null}), or a failure. */
    private record Fetched(List<SourceRow> rows, RuntimeException failure) {
    }
}
