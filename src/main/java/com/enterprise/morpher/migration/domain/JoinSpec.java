package com.enterprise.morpher.migration.domain;

import com.enterprise.morpher.sql.core.JoinType;

import java.util.Objects;

/**
 * One join of a migration: the joined table, its raw ON predicate and the join type.
 */
public record JoinSpec(String table, String onClause, JoinType type) {

    public JoinSpec {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(onClause, "onClause");
        if (type == null) {
            type = JoinType.INNER;
        }
    }

    public JoinSpec(String table, String onClause) {
        this(table, onClause, JoinType.INNER);
    }
}
