package com.enterprise.morpher.sql.core;

/**
 * How a joined table combines with the rows reachable before it. Outer joins
 * leave the columns of the unmatched side null, which reaches the row
 * transform as an explicit null value.
 */
public enum JoinType {
    INNER("INNER JOIN", false),
    LEFT("LEFT JOIN", true),
    RIGHT("RIGHT JOIN", true),
    FULL("FULL JOIN", true);

    private final String sql;
    private final boolean outer;

    JoinType(String sql, boolean outer) {
        this.sql = sql;
        this.outer = outer;
    }

    public String sql() { return sql; }

    public boolean isOuter() { return outer; }

    /** {@code LEFT JOIN profiles ON users.id = profiles.user_id} */
    public String clause(String table, String onClause) {
        return sql + " " + table + " ON " + onClause;
    }
}
