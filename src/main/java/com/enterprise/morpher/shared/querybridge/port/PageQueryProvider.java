package com.enterprise.morpher.shared.querybridge.port;

import com.enterprise.morpher.sql.builder.SqlResult;

/**
 * Builds the read query for one page of a paged source read.
 *
 * <p>Each call MUST create a fresh
 * {@link com.enterprise.morpher.sql.builder.SelectBuilder}; never reuse
 * builder instances across calls.
 */
@FunctionalInterface
public interface PageQueryProvider {

    /**
     * @param pageIndex zero-based page number
     * @return verified SqlResult for that page
     */
    SqlResult buildQuery(int pageIndex);
}
