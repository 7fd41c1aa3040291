package com.enterprise.morpher.shared.querybridge.adapter;

import com.enterprise.morpher.sql.builder.InsertBuilder;
import com.enterprise.morpher.sql.builder.SelectBuilder;
import com.enterprise.morpher.sql.builder.SqlResult;
import com.enterprise.morpher.sql.builder.UpsertBuilder;
import com.enterprise.morpher.sql.core.Dialects;
import com.enterprise.morpher.sql.core.QualifiedColumn;
import com.enterprise.morpher.sql.core.SortDirection;
import com.enterprise.morpher.support.TestDatabases;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JdbcDatabaseConnectionTest {

    private EmbeddedDatabase db;
    private JdbcTemplate jdbc;
    private JdbcDatabaseConnection connection;

    @BeforeEach
    void setUp() {
        db = TestDatabases.h2();
        jdbc = new JdbcTemplate(db);
        TestDatabases.createUsersAndProfiles(jdbc);
        TestDatabases.createNewUsers(jdbc, true);
        connection = new JdbcDatabaseConnection("test", db);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    void testDialectDetectedFromMetadata() {
        assertThat(connection.dialect()).isSameAs(Dialects.H2);
    }

    @Test
    void testFixedDialectWins() {
        assertThat(new JdbcDatabaseConnection("test", db, Dialects.ANSI).dialect()).isSameAs(Dialects.ANSI);
    }

    @Test
    void testQueryWithNamedParameters() {
        SqlResult select = SelectBuilder.query()
                .select("users.username AS c1_username")
                .from("users")
                .orderBy(QualifiedColumn.parse("users.id"), SortDirection.ASC)
                .build();

        List<String> names = connection.query(select, (rs, rowNum) -> rs.getString("c1_username"));

        assertThat(names).containsExactly("a", "b");
    }

    @Test
    void testMultiRowInsertAndMerge() {
        connection.update(InsertBuilder.insert()
                .dialect(Dialects.H2)
                .into("new_users")
                .columns("id", "username", "phone")
                .valuesOrNull(1, "a", "555")
                .valuesOrNull(2, "b", null)
                .build());
        connection.update(UpsertBuilder.upsert(Dialects.H2.upsertStyle())
                .into("new_users")
                .columns("id", "username", "phone")
                .keys("id")
                .valuesOrNull(2, "bee", "777")
                .build());

        assertThat(TestDatabases.count(jdbc, "new_users")).isEqualTo(2);
        assertThat(jdbc.queryForObject("SELECT username FROM new_users WHERE id = 2", String.class))
                .isEqualTo("bee");
        assertThat(jdbc.queryForObject("SELECT phone FROM new_users WHERE id = 1", String.class))
                .isEqualTo("555");
    }

    @Test
    void testTransactionRollsBackOnFailure() {
        SqlResult insert = InsertBuilder.insert().into("new_users").columns("id").valuesOrNull(9).build();

        assertThatThrownBy(() -> connection.inTransaction(() -> {
            connection.update(insert);
            connection.update(insert);
            return null;
        })).isInstanceOf(DataIntegrityViolationException.class);

        assertThat(TestDatabases.count(jdbc, "new_users")).isZero();
    }

    @Test
    void testColumnNamesIgnoreCase() {
        assertThat(connection.columnNames("users")).containsExactlyInAnyOrder("ID", "USERNAME");
        assertThat(connection.columnNames("PROFILES")).containsExactlyInAnyOrder("USER_ID", "PHONE");
        assertThat(connection.columnNames("countries")).isEmpty();
    }
}
