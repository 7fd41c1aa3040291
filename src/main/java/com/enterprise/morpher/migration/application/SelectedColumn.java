package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.sql.core.QualifiedColumn;

/**
 * A source column as it appears in the SELECT list, with the alias rows are read by.
 */
public record SelectedColumn(QualifiedColumn source, String alias) {

    private static final int MAX_ALIAS_NAME = 20;

    /**
     * Alias {@code c<position>_<column>}, unique by position and short enough
     * for 30-character identifier limits.
     */
    static SelectedColumn at(int position, QualifiedColumn source) {
        String name = source.column().replaceAll("\\W", "_");
        if (name.length() > MAX_ALIAS_NAME) {
            name = name.substring(0, MAX_ALIAS_NAME);
        }
        return new SelectedColumn(source, "c" + position + "_" + name);
    }

    public String selectExpression() {
        return source.refAs(alias);
    }
}
