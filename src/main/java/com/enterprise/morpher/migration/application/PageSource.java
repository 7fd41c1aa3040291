package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.SourceRow;

import java.util.List;

/**
 * Source rows in pages, in read order.
 */
public interface PageSource extends AutoCloseable {

    /**
     * @return the next page, or {@code null} once the source is exhausted
     * @throws com.enterprise.morpher.migration.domain.QueryException      page unreadable after its retry
     * @throws com.enterprise.morpher.migration.domain.ConnectionException source unreachable
     */
    List<SourceRow> nextPage();

    @Override
    default void close() {
    }
}
