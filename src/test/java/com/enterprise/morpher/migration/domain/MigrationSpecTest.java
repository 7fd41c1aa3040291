package com.enterprise.morpher.migration.domain;

import com.enterprise.morpher.sql.core.JoinType;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MigrationSpecTest {

    @Test
    void testDefaults() {
        MigrationSpec spec = MigrationSpec.builder("users")
                .rootTable("users")
                .join("profiles", "users.id = profiles.user_id")
                .column("users.id", "id")
                .build();

        assertThat(spec.targetTable()).isEqualTo("users");
        assertThat(spec.writeMode()).isEqualTo(WriteMode.INSERT);
        assertThat(spec.joins().get(0).type()).isEqualTo(JoinType.INNER);
        assertThat(spec.hasTransform()).isFalse();
        assertThat(new JoinSpec("t", "a.x = t.x", null).type()).isEqualTo(JoinType.INNER);
    }

    @Test
    void testColumnMappingKeepsInsertionOrder() {
        MigrationSpec spec = MigrationSpec.builder("users")
                .rootTable("users")
                .column("users.username", "username")
                .column("users.id", "id")
                .column("users.email", "email")
                .build();

        assertThat(spec.columnMapping().keySet()).containsExactly("users.username", "users.id", "users.email");
        assertThat(spec.targetColumns()).containsExactly("username", "id", "email");
    }

    @Test
    void testUpsertOn() {
        MigrationSpec spec = MigrationSpec.builder("users").rootTable("users")
                .column("users.id", "id").upsertOn("id").build();

        assertThat(spec.writeMode()).isEqualTo(WriteMode.UPSERT);
        assertThat(spec.keyColumns()).containsExactly("id");
    }

    @Test
    void testAbsentIsNotCoerced() {
        FieldValue absent = FieldValue.of(null);

        assertThat(absent.isAbsent()).isTrue();
        assertThat(absent.orNull()).isNull();
        assertThat(absent).isNotEqualTo(FieldValue.of(0)).isNotEqualTo(FieldValue.of(""));
        assertThat(FieldValue.of(FieldValue.of("x"))).isEqualTo(FieldValue.of("x"));
    }

    @Test
    void testTargetRowIdentifier() {
        TargetRow row = TargetRow.of(Map.of("id", 2));

        assertThat(row.identifier()).isEqualTo("id=2");
        assertThat(TargetRow.of(Collections.singletonMap("id", null)).identifier()).isEqualTo("id=NULL");
    }
}
