package com.enterprise.morpher.support;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.List;
import java.util.Map;

/**
 * Throwaway in-memory H2 databases for engine tests.
 */
public final class TestDatabases {

    private TestDatabases() {}

    public static EmbeddedDatabase h2() {
        return new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
    }

    /** users(id, username) + profiles(user_id, phone): users 1 'a', 2 'b'; profile of user 1 has phone 555. */
    public static void createUsersAndProfiles(JdbcTemplate jdbc) {
        jdbc.execute("CREATE TABLE users (id INT PRIMARY KEY, username VARCHAR(50))");
        jdbc.execute("CREATE TABLE profiles (user_id INT, phone VARCHAR(20))");
        jdbc.update("INSERT INTO users VALUES (1, 'a'), (2, 'b')");
        jdbc.update("INSERT INTO profiles VALUES (1, '555')");
    }

    public static void createNewUsers(JdbcTemplate jdbc, boolean primaryKey) {
        jdbc.execute("CREATE TABLE new_users (id INT" + (primaryKey ? " PRIMARY KEY" : "")
                + ", username VARCHAR(50), phone VARCHAR(20))");
    }

    public static List<Map<String, Object>> rows(JdbcTemplate jdbc, String sql) {
        return jdbc.queryForList(sql);
    }

    public static long count(JdbcTemplate jdbc, String table) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0 : count;
    }
}
