package com.enterprise.morpher.config;

import com.enterprise.morpher.migration.domain.EngineSettings;
import com.enterprise.morpher.migration.domain.FailurePolicy;
import com.enterprise.morpher.migration.domain.JoinSpec;
import com.enterprise.morpher.migration.domain.MigrationSpec;
import com.enterprise.morpher.migration.domain.WriteMode;
import com.enterprise.morpher.shared.querybridge.adapter.ConnectionDescriptor;
import com.enterprise.morpher.sql.core.JoinType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Source, target, engine tuning and migrations, bound from the {@code morpher.*} prefix.
 *
 * <pre>
 * morpher:
 *   source: {type: postgresql, host: db, database: legacy, user: app, password-env: DB_SOURCE_PASSWORD}
 *   target: {type: h2, database: target}
 *   engine: {page-size: 500, batch-size: 100, retry-delay: 200ms}
 *   migrations:
 *     - name: users
 *       root-table: users
 *       target-table: new_users
 *       joins: [{table: profiles, on-clause: "users.id = profiles.user_id", type: LEFT}]
 *       columns: {"[users.id]": id, "[profiles.phone]": phone}
 * </pre>
 *
 * Mapping keys contain dots, so they are written in brackets to keep them whole.
 */
@ConfigurationProperties(prefix = "morpher")
@Validated
public record MorpherProperties(
        @NotNull @Valid DatabaseProperties source,
        @NotNull @Valid DatabaseProperties target,
        EngineProperties engine,
        List<@Valid MigrationProperties> migrations) {

    public MorpherProperties {
        if (engine == null) {
            engine = new EngineProperties(null, null, null, null, null, null, null);
        }
        migrations = migrations == null ? List.of() : List.copyOf(migrations);
    }

    public List<MigrationSpec> migrationSpecs() {
        return migrations.stream().map(MigrationProperties::toSpec).toList();
    }

    /**
     * @param passwordEnv name of the environment variable holding the password
     * @param options     driver options appended to the JDBC URL
     */
    public record DatabaseProperties(
            @NotBlank String type,
            String host,
            Integer port,
            String database,
            String path,
            String user,
            String passwordEnv,
            Map<String, String> options) {

        public ConnectionDescriptor toDescriptor() {
            return new ConnectionDescriptor(type, host, port, database, path, options == null ? Map.of() : options);
        }
    }

    /**
     * Defaults: 500-row pages, 100-row batches, 200 ms retry delay, no prefetch,
     * best-effort failure policy, schema check on.
     */
    public record EngineProperties(
            Integer pageSize,
            Integer batchSize,
            Duration retryDelay,
            Integer prefetchPages,
            Double maxTransformFailureRate,
            Double maxWriteFailureRate,
            Boolean validateSchema) {

        public EngineProperties {
            if (pageSize == null) {
                pageSize = EngineSettings.DEFAULT_PAGE_SIZE;
            }
            if (batchSize == null) {
                batchSize = EngineSettings.DEFAULT_BATCH_SIZE;
            }
            if (retryDelay == null) {
                retryDelay = EngineSettings.DEFAULT_RETRY_DELAY;
            }
            if (prefetchPages == null) {
                prefetchPages = 0;
            }
            if (maxTransformFailureRate == null) {
                maxTransformFailureRate = 1.0;
            }
            if (maxWriteFailureRate == null) {
                maxWriteFailureRate = 1.0;
            }
            if (validateSchema == null) {
                validateSchema = true;
            }
        }

        public EngineSettings toSettings() {
            return new EngineSettings(pageSize, batchSize, retryDelay, prefetchPages,
                    new FailurePolicy(maxTransformFailureRate, maxWriteFailureRate), validateSchema);
        }
    }

    /**
     * @param columns qualified source column to target column, in insert order
     */
    public record MigrationProperties(
            @NotBlank String name,
            @NotBlank String rootTable,
            String targetTable,
            List<@Valid JoinProperties> joins,
            Map<String, String> columns,
            String transformFunction,
            List<String> orderBy,
            WriteMode writeMode,
            List<String> keyColumns) {

        public MigrationSpec toSpec() {
            List<JoinSpec> joinSpecs = joins == null
                    ? List.of()
                    : joins.stream().map(j -> new JoinSpec(j.table(), j.onClause(), j.type())).toList();
            return new MigrationSpec(name, rootTable, targetTable, joinSpecs, columns, transformFunction,
                    orderBy, writeMode, keyColumns);
        }
    }

    /**
     * @param type INNER when omitted
     */
    public record JoinProperties(@NotBlank String table, @NotBlank String onClause, JoinType type) {
    }
}
