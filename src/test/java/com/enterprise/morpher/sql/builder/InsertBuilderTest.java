package com.enterprise.morpher.sql.builder;

import com.enterprise.morpher.sql.core.Dialects;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InsertBuilderTest {

    @Test
    void testMultiRowValues() {
        SqlResult r = InsertBuilder.insert()
                .into("new_users")
                .columns("id", "username", "phone")
                .valuesOrNull(1, "a", "555")
                .valuesOrNull(2, "b", null)
                .build();

        assertThat(r.sql()).isEqualTo(
                "INSERT INTO new_users (id, username, phone)"
                + " VALUES (:id_1, :username_1, :phone_1), (:id_2, :username_2, NULL)");

        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("id_1", 1);
        expected.put("username_1", "a");
        expected.put("phone_1", "555");
        expected.put("id_2", 2);
        expected.put("username_2", "b");
        assertThat(r.namedParameters()).containsExactlyEntriesOf(expected);
    }

    @Test
    void testOracleUsesInsertAll() {
        SqlResult r = InsertBuilder.insert()
                .dialect(Dialects.ORACLE)
                .into("new_users")
                .columns("id", "username")
                .valuesOrNull(1, "a")
                .valuesOrNull(2, "b")
                .build();

        assertThat(r.sql()).isEqualTo(
                "INSERT ALL"
                + " INTO new_users (id, username) VALUES (:id_1, :username_1)"
                + " INTO new_users (id, username) VALUES (:id_2, :username_2)"
                + " SELECT 1 FROM DUAL");
    }

    @Test
    void testOracleSingleRowIsPlainInsert() {
        SqlResult r = InsertBuilder.insert()
                .dialect(Dialects.ORACLE)
                .into("new_users")
                .columns("id")
                .valuesOrNull(1)
                .build();

        assertThat(r.sql()).isEqualTo("INSERT INTO new_users (id) VALUES (:id_1)");
    }

    @Test
    void testColumnCountMismatchThrows() {
        InsertBuilder builder = InsertBuilder.insert().into("new_users").columns("id", "username");

        assertThatThrownBy(() -> builder.valuesOrNull(1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Value count (1) != column count (2)");
    }

    @Test
    void testNoRowsThrows() {
        assertThatThrownBy(() -> InsertBuilder.insert().into("new_users").columns("id").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No values");
    }

    @Test
    void testDebugStringInlinesValues() {
        SqlResult r = InsertBuilder.insert()
                .into("new_users")
                .columns("id", "username")
                .valuesOrNull(7, "o'neil")
                .build();

        assertThat(r.toDebugString())
                .isEqualTo("INSERT INTO new_users (id, username) VALUES (7, 'o''neil')");
    }
}
