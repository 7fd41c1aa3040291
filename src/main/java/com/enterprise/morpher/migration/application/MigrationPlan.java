package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.MigrationSpec;
import com.enterprise.morpher.migration.domain.RowTransform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A migration that passed planning, ready to run.
 *
 * @param columnMapping source column to target column, keyed by the parsed
 *                      {@code table.column} reference the read query selects
 * @param transform     the resolved transform, or {@code null}
 */
public record MigrationPlan(MigrationSpec spec, JoinPlan joinPlan, CompiledQuery query,
                            Map<String, String> columnMapping, RowTransform transform) {

    public MigrationPlan {
        columnMapping = Collections.unmodifiableMap(new LinkedHashMap<>(columnMapping));
    }

    public String name() {
        return spec.name();
    }
}
