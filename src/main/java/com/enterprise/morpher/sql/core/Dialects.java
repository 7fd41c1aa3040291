package com.enterprise.morpher.sql.core;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public final class Dialects {

    private Dialects() {}

    private static final Set<JoinType> ALL_JOINS = EnumSet.allOf(JoinType.class);

    public static final SqlDialect ANSI = new StandardDialect(
            "ANSI", Paging.OFFSET_FETCH, ALL_JOINS, true, UpsertStyle.NONE);

    // Oracle 12c+ pages with ANSI FETCH FIRST but has no multi-row VALUES before 23c
    public static final SqlDialect ORACLE = new StandardDialect(
            "Oracle", Paging.OFFSET_FETCH, ALL_JOINS, false, UpsertStyle.NONE);

    public static final SqlDialect SQL_SERVER = new StandardDialect(
            "SQL Server", Paging.OFFSET_FETCH, ALL_JOINS, true, UpsertStyle.NONE);

    // H2 has no FULL OUTER JOIN
    public static final SqlDialect H2 = new StandardDialect(
            "H2", Paging.OFFSET_FETCH,
            EnumSet.of(JoinType.INNER, JoinType.LEFT, JoinType.RIGHT), true, UpsertStyle.MERGE_KEY);

    public static final SqlDialect POSTGRESQL = new StandardDialect(
            "PostgreSQL", Paging.LIMIT_OFFSET, ALL_JOINS, true, UpsertStyle.ON_CONFLICT);

    public static final SqlDialect MYSQL = new StandardDialect(
            "MySQL", Paging.LIMIT_OFFSET,
            EnumSet.of(JoinType.INNER, JoinType.LEFT, JoinType.RIGHT), true, UpsertStyle.ON_DUPLICATE_KEY);

    // RIGHT and FULL only arrived in SQLite 3.39; stay on the safe side
    public static final SqlDialect SQLITE = new StandardDialect(
            "SQLite", Paging.LIMIT_OFFSET,
            EnumSet.of(JoinType.INNER, JoinType.LEFT), true, UpsertStyle.ON_CONFLICT);

    /**
     * Picks a dialect from {@code DatabaseMetaData#getDatabaseProductName()}.
     * Unknown products fall back to {@link #ANSI}.
     */
    public static SqlDialect forProductName(String productName) {
        if (productName == null) {
            return ANSI;
        }
        String p = productName.toLowerCase(Locale.ROOT);
        if (p.contains("h2")) return H2;
        if (p.contains("postgres")) return POSTGRESQL;
        if (p.contains("mysql") || p.contains("mariadb")) return MYSQL;
        if (p.contains("sqlite")) return SQLITE;
        if (p.contains("oracle")) return ORACLE;
        if (p.contains("sql server")) return SQL_SERVER;
        return ANSI;
    }

    private enum Paging { OFFSET_FETCH, LIMIT_OFFSET }

    private record StandardDialect(String name, Paging paging, Set<JoinType> joins,
                                   boolean supportsMultiRowValues,
                                   UpsertStyle upsertStyle) implements SqlDialect {

        @Override
        public String page(int count, long skip) {
            return paging == Paging.OFFSET_FETCH
                    ? "OFFSET " + skip + " ROWS FETCH NEXT " + count + " ROWS ONLY"
                    : "LIMIT " + count + " OFFSET " + skip;
        }

        @Override
        public boolean supportsJoin(JoinType type) {
            return joins.contains(type);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
