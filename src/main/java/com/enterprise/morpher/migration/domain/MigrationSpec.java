package com.enterprise.morpher.migration.domain;

import com.enterprise.morpher.sql.core.JoinType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of one table migration.
 *
 * <p>{@code columnMapping} maps a qualified source column ({@code table.column})
 * to a target column; its iteration order is the SELECT order and the insert
 * column order.
 *
 * <pre>{@code
 * MigrationSpec users = MigrationSpec.builder("users")
 *     .rootTable("users")
 *     .targetTable("new_users")
 *     .join(JoinType.LEFT, "profiles", "users.id = profiles.user_id")
 *     .column("users.id", "id")
 *     .column("users.username", "username")
 *     .column("profiles.phone", "phone")
 *     .build();
 * }</pre>
 *
 * @param transformFunction registry name of the row transform, or {@code null}
 * @param orderBy           qualified columns ordering the paged read; empty means the first mapped column
 * @param keyColumns        target columns matched by {@link WriteMode#UPSERT}
 */
public record MigrationSpec(
        String name,
        String rootTable,
        String targetTable,
        List<JoinSpec> joins,
        Map<String, String> columnMapping,
        String transformFunction,
        List<String> orderBy,
        WriteMode writeMode,
        List<String> keyColumns) {

    public MigrationSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rootTable, "rootTable");
        if (targetTable == null || targetTable.isBlank()) {
            targetTable = rootTable;
        }
        joins = joins == null ? List.of() : List.copyOf(joins);
        columnMapping = columnMapping == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(columnMapping));
        if (transformFunction != null && transformFunction.isBlank()) {
            transformFunction = null;
        }
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        writeMode = writeMode == null ? WriteMode.INSERT : writeMode;
        keyColumns = keyColumns == null ? List.of() : List.copyOf(keyColumns);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean hasTransform() {
        return transformFunction != null;
    }

    /** Target columns in insert order. */
    public List<String> targetColumns() {
        return new ArrayList<>(columnMapping.values());
    }

    public static final class Builder {

        private final String name;
        private String rootTable;
        private String targetTable;
        private final List<JoinSpec> joins = new ArrayList<>();
        private final Map<String, String> columnMapping = new LinkedHashMap<>();
        private String transformFunction;
        private final List<String> orderBy = new ArrayList<>();
        private WriteMode writeMode = WriteMode.INSERT;
        private final List<String> keyColumns = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder rootTable(String rootTable) {
            this.rootTable = rootTable;
            return this;
        }

        public Builder targetTable(String targetTable) {
            this.targetTable = targetTable;
            return this;
        }

        public Builder join(JoinType type, String table, String onClause) {
            joins.add(new JoinSpec(table, onClause, type));
            return this;
        }

        public Builder join(String table, String onClause) {
            return join(JoinType.INNER, table, onClause);
        }

        public Builder column(String qualifiedSource, String targetColumn) {
            columnMapping.put(qualifiedSource, targetColumn);
            return this;
        }

        public Builder columns(Map<String, String> mapping) {
            columnMapping.putAll(mapping);
            return this;
        }

        public Builder transform(String transformFunction) {
            this.transformFunction = transformFunction;
            return this;
        }

        public Builder orderBy(String... qualifiedColumns) {
            orderBy.addAll(List.of(qualifiedColumns));
            return this;
        }

        public Builder upsertOn(String... keys) {
            this.writeMode = WriteMode.UPSERT;
            keyColumns.addAll(List.of(keys));
            return this;
        }

        public Builder writeMode(WriteMode writeMode) {
            this.writeMode = writeMode;
            return this;
        }

        public Builder keyColumns(List<String> keys) {
            keyColumns.addAll(keys);
            return this;
        }

        public MigrationSpec build() {
            return new MigrationSpec(name, rootTable, targetTable, joins, columnMapping,
                    transformFunction, orderBy, writeMode, keyColumns);
        }
    }
}
