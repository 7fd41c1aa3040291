package com.enterprise.morpher.sql.builder;

import com.enterprise.morpher.sql.core.UpsertStyle;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class UpsertBuilderTest {

    private static UpsertBuilder usersUpsert(UpsertStyle style) {
        return UpsertBuilder.upsert(style)
                .into("new_users")
                .columns("id", "username")
                .keys("id")
                .valuesOrNull(1, "a");
    }

    @Test
    void testH2MergeKey() {
        assertThat(usersUpsert(UpsertStyle.MERGE_KEY).build().sql())
                .isEqualTo("MERGE INTO new_users (id, username) KEY (id) VALUES (:id_1, :username_1)");
    }

    @Test
    void testOnConflictUpdatesNonKeyColumns() {
        assertThat(usersUpsert(UpsertStyle.ON_CONFLICT).build().sql())
                .isEqualTo("INSERT INTO new_users (id, username) VALUES (:id_1, :username_1)"
                        + " ON CONFLICT (id) DO UPDATE SET username = EXCLUDED.username");
    }

    @Test
    void testOnDuplicateKey() {
        assertThat(usersUpsert(UpsertStyle.ON_DUPLICATE_KEY).build().sql())
                .isEqualTo("INSERT INTO new_users (id, username) VALUES (:id_1, :username_1)"
                        + " ON DUPLICATE KEY UPDATE username = VALUES(username)");
    }

    @Test
    void testAllKeyColumnsOnConflictDoesNothing() {
        SqlResult r = UpsertBuilder.upsert(UpsertStyle.ON_CONFLICT)
                .into("tags").columns("id").keys("id").valuesOrNull(1).build();

        assertThat(r.sql()).endsWith("ON CONFLICT (id) DO NOTHING");
    }

    @Test
    void testAllKeyColumnsOnDuplicateKeyAssignsKey() {
        SqlResult r = UpsertBuilder.upsert(UpsertStyle.ON_DUPLICATE_KEY)
                .into("tags").columns("id").keys("id").valuesOrNull(1).build();

        assertThat(r.sql()).endsWith("ON DUPLICATE KEY UPDATE id = id");
    }

    @Test
    void testKeyOutsideColumnsThrows() {
        UpsertBuilder builder = UpsertBuilder.upsert(UpsertStyle.MERGE_KEY)
                .into("new_users").columns("username").keys("id").valuesOrNull("a");

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Key column 'id'");
    }

    @Test
    void testNoUpsertStyleThrows() {
        assertThatThrownBy(() -> usersUpsert(UpsertStyle.NONE).build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testNullValueIsLiteral() {
        SqlResult r = UpsertBuilder.upsert(UpsertStyle.MERGE_KEY)
                .into("new_users").columns("id", "username").keys("id").valuesOrNull(1, null).build();

        assertThat(r.sql()).isEqualTo("MERGE INTO new_users (id, username) KEY (id) VALUES (:id_1, NULL)");
        assertThat(r.namedParameters()).containsOnlyKeys("id_1");
    }
}
