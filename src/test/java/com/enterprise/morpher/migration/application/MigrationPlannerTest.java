package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ConfigException;
import com.enterprise.morpher.migration.domain.ConfigException.Reason;
import com.enterprise.morpher.migration.domain.MigrationSpec;
import com.enterprise.morpher.migration.domain.RowTransform;
import com.enterprise.morpher.migration.domain.TransformRegistry;
import com.enterprise.morpher.sql.core.Dialects;
import com.enterprise.morpher.sql.core.JoinType;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class MigrationPlannerTest {

    private static final RowTransform NOOP = (source, projected) -> Map.of();
    private static final TransformRegistry REGISTRY = TransformRegistry.builder().register("noop", NOOP).build();

    private static final Map<String, Set<String>> SCHEMA = Map.of(
            "users", Set.of("ID", "USERNAME"),
            "profiles", Set.of("USER_ID", "PHONE"));
    private static final Function<String, Set<String>> COLUMNS =
            table -> SCHEMA.getOrDefault(table.toLowerCase(), Set.of());

    private final MigrationPlanner planner = new MigrationPlanner();

    private static MigrationSpec.Builder users() {
        return MigrationSpec.builder("users")
                .rootTable("users")
                .targetTable("new_users")
                .join(JoinType.LEFT, "profiles", "users.id = profiles.user_id")
                .column("users.id", "id")
                .column("users.username", "username")
                .column("profiles.phone", "phone");
    }

    private ConfigException planFailure(MigrationSpec spec) {
        Throwable thrown = catchThrowable(() -> planner.plan(spec, REGISTRY, 100, Dialects.H2, Dialects.H2, COLUMNS));
        assertThat(thrown).isInstanceOf(ConfigException.class);
        return (ConfigException) thrown;
    }

    @Test
    void testValidMigrationIsPlanned() {
        MigrationPlan plan = planner.plan(users().transform("noop").build(), REGISTRY, 100,
                Dialects.H2, Dialects.H2, COLUMNS);

        assertThat(plan.name()).isEqualTo("users");
        assertThat(plan.joinPlan().tables()).containsExactly("users", "profiles");
        assertThat(plan.transform()).isSameAs(NOOP);
        assertThat(plan.query().buildQuery(0).sql()).startsWith("SELECT users.id AS c1_id");
    }

    @Test
    void testUnknownTransform() {
        ConfigException e = planFailure(users().transform("missing").build());

        assertThat(e.reason()).isEqualTo(Reason.UNKNOWN_TRANSFORM);
        assertThat(e).hasMessageStartingWith("Migration 'users': Transform function 'missing' not found");
    }

    @Test
    void testNoColumns() {
        MigrationSpec spec = MigrationSpec.builder("empty").rootTable("users").build();

        assertThat(planFailure(spec).reason()).isEqualTo(Reason.INVALID_COLUMN_REFERENCE);
    }

    @Test
    void testUnqualifiedSourceColumn() {
        assertThat(planFailure(users().column("email", "email").build()).reason())
                .isEqualTo(Reason.INVALID_COLUMN_REFERENCE);
    }

    @Test
    void testColumnOfUnjoinedTable() {
        assertThat(planFailure(users().column("orders.total", "total").build()).reason())
                .isEqualTo(Reason.INVALID_COLUMN_REFERENCE);
    }

    @Test
    void testTargetColumnMappedTwice() {
        assertThat(planFailure(users().column("profiles.user_id", "ID").build()))
                .hasMessageContaining("mapped more than once");
    }

    @Test
    void testMissingSourceColumn() {
        ConfigException e = planFailure(users().column("users.email", "email").build());

        assertThat(e.reason()).isEqualTo(Reason.INVALID_COLUMN_REFERENCE);
        assertThat(e).hasMessageContaining("email");
    }

    @Test
    void testMissingSourceTable() {
        MigrationSpec spec = MigrationSpec.builder("orders").rootTable("orders").column("orders.id", "id").build();

        assertThat(planFailure(spec).reason()).isEqualTo(Reason.BROKEN_JOIN_GRAPH);
    }

    @Test
    void testSchemaCheckSkippedWithoutLookup() {
        MigrationSpec spec = MigrationSpec.builder("orders").rootTable("orders").column("orders.id", "id").build();

        assertThat(planner.plan(spec, REGISTRY, 100, Dialects.H2, Dialects.H2, null).name()).isEqualTo("orders");
    }

    @Test
    void testUpsertKeyMustBeMapped() {
        assertThat(planFailure(users().upsertOn("user_id").build()).reason())
                .isEqualTo(Reason.INVALID_COLUMN_REFERENCE);
    }

    @Test
    void testUpsertOnTargetWithoutUpsert() {
        MigrationSpec spec = users().upsertOn("id").build();

        assertThatThrownBy(() -> planner.plan(spec, REGISTRY, 100, Dialects.H2, Dialects.ORACLE, COLUMNS))
                .isInstanceOfSatisfying(ConfigException.class,
                        e -> assertThat(e.reason()).isEqualTo(Reason.UNSUPPORTED_WRITE_MODE));
    }

    @Test
    void testFullJoinOnSourceWithoutIt() {
        MigrationSpec spec = MigrationSpec.builder("users").rootTable("users")
                .join(JoinType.FULL, "profiles", "users.id = profiles.user_id")
                .column("users.id", "id")
                .build();

        assertThat(planFailure(spec).reason()).isEqualTo(Reason.UNSUPPORTED_JOIN_TYPE);
    }

    @Test
    void testBrokenJoinGraph() {
        MigrationSpec spec = users().join("items", "orders.id = items.order_id").build();

        assertThat(planFailure(spec).reason()).isEqualTo(Reason.BROKEN_JOIN_GRAPH);
    }

    @Test
    void testMissingOnClauseColumn() {
        MigrationSpec spec = MigrationSpec.builder("users").rootTable("users").targetTable("new_users")
                .join(JoinType.LEFT, "profiles", "users.id = profiles.usr_id")
                .column("users.id", "id")
                .build();

        ConfigException e = planFailure(spec);

        assertThat(e.reason()).isEqualTo(Reason.INVALID_COLUMN_REFERENCE);
        assertThat(e).hasMessageContaining("Column 'usr_id' not found in table 'profiles'");
    }

    @Test
    void testOnClauseLiteralIsNotAColumn() {
        MigrationSpec spec = MigrationSpec.builder("users").rootTable("users").targetTable("new_users")
                .join(JoinType.LEFT, "profiles", "users.id = profiles.user_id AND profiles.phone <> 'n.a'")
                .column("users.id", "id")
                .build();

        assertThat(planner.plan(spec, REGISTRY, 100, Dialects.H2, Dialects.H2, COLUMNS).name()).isEqualTo("users");
    }

    @Test
    void testSourceReferenceIsTrimmedForProjection() {
        MigrationSpec spec = MigrationSpec.builder("users").rootTable("users").targetTable("new_users")
                .column("users.id ", "id")
                .column(" users.username", "username")
                .build();

        MigrationPlan plan = planner.plan(spec, REGISTRY, 100, Dialects.H2, Dialects.H2, COLUMNS);

        assertThat(plan.columnMapping()).containsExactly(entry("users.id", "id"), entry("users.username", "username"));
    }

    @Test
    void testSameSourceColumnSpelledTwice() {
        MigrationSpec spec = users().column("USERS.ID", "legacy_id").build();

        ConfigException e = planFailure(spec);

        assertThat(e.reason()).isEqualTo(Reason.INVALID_COLUMN_REFERENCE);
        assertThat(e).hasMessageContaining("Source column 'USERS.ID' is mapped more than once");
    }
}
