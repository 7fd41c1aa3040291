package com.enterprise.morpher.sql.core;

import java.util.Locale;
import java.util.Objects;

/**
 * A {@code table.column} reference. The table part may itself be schema-qualified
 * ({@code sales.orders.id} is table {@code sales.orders}, column {@code id}).
 */
public record QualifiedColumn(String table, String column) {

    public QualifiedColumn {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(column, "column");
    }

    /**
     * Splits at the last dot.
     *
     * @throws IllegalArgumentException if the reference is not table-qualified
     */
    public static QualifiedColumn parse(String reference) {
        if (reference == null) {
            throw new IllegalArgumentException("Column reference cannot be null");
        }
        String trimmed = reference.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot <= 0 || dot == trimmed.length() - 1) {
            throw new IllegalArgumentException(
                    "Column reference must be table-qualified (table.column): " + reference);
        }
        return new QualifiedColumn(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    /** Qualified reference: table.column */
    public String ref() {
        return table + "." + column;
    }

    /** Qualified reference with an AS alias */
    public String refAs(String alias) {
        return ref() + " AS " + alias;
    }

    /** Case-insensitive table match, the way unquoted SQL identifiers compare. */
    public boolean belongsTo(String tableName) {
        return table.toLowerCase(Locale.ROOT).equals(tableName.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return ref();
    }
}
