package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.CancellationSignal;
import com.enterprise.morpher.migration.domain.SourceRow;

import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamReader;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;

/**
 * Row-at-a-time view over a {@link PageSource}. Cancellation is checked before
 * each page is fetched; a cancelled reader ends as if the source were exhausted
 * and reports {@link #wasCancelled()}.
 */
public class PagedRowReader implements ItemStreamReader<SourceRow> {

    static final String READ_COUNT_KEY = "morpher.reader.read.count";

    private final PageSource pages;
    private final CancellationSignal cancellation;
    private final MigrationRunContext context;
    private final ArrayDeque<SourceRow> buffer = new ArrayDeque<>();
    private boolean exhausted;
    private boolean cancelled;

    public PagedRowReader(PageSource pages, CancellationSignal cancellation, MigrationRunContext context) {
        this.pages = Objects.requireNonNull(pages, "pages");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public SourceRow read() {
        while (buffer.isEmpty()) {
            if (exhausted || cancelled) {
                return null;
            }
            if (cancellation.isCancelled()) {
                cancelled = true;
                return null;
            }
            List<SourceRow> page = pages.nextPage();
            if (page == null) {
                exhausted = true;
                return null;
            }
            buffer.addAll(page);
        }
        context.rowRead();
        return buffer.poll();
    }

    public boolean wasCancelled() {
        return cancelled;
    }

    @Override
    public void open(ExecutionContext executionContext) {
    }

    @Override
    public void update(ExecutionContext executionContext) {
        executionContext.putLong(READ_COUNT_KEY, context.rowsRead());
    }

    @Override
    public void close() {
        pages.close();
    }
}
