package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.JoinSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A validated join tree: the root table followed by its joins in declaration order.
 */
public record JoinPlan(String rootTable, List<JoinSpec> joins) {

    public JoinPlan {
        joins = List.copyOf(joins);
    }

    /** Root first, then every joined table in plan order. */
    public List<String> tables() {
        List<String> tables = new ArrayList<>();
        tables.add(rootTable);
        joins.forEach(join -> tables.add(join.table()));
        return tables;
    }

    /** Tables joined by an outer join, whose columns may arrive as null. */
    public List<String> outerJoinedTables() {
        return joins.stream().filter(join -> join.type().isOuter()).map(JoinSpec::table).toList();
    }

    public boolean contains(String table) {
        String wanted = table.toLowerCase(Locale.ROOT);
        return tables().stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).equals(wanted));
    }
}
