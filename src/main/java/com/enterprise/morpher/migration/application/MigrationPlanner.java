package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ConfigException;
import com.enterprise.morpher.migration.domain.ConfigException.Reason;
import com.enterprise.morpher.migration.domain.JoinSpec;
import com.enterprise.morpher.migration.domain.MigrationSpec;
import com.enterprise.morpher.migration.domain.RowTransform;
import com.enterprise.morpher.migration.domain.TransformRegistry;
import com.enterprise.morpher.migration.domain.WriteMode;
import com.enterprise.morpher.sql.core.QualifiedColumn;
import com.enterprise.morpher.sql.core.SqlDialect;
import com.enterprise.morpher.sql.core.UpsertStyle;
import com.enterprise.morpher.sql.validation.ExpressionValidator;
import com.enterprise.morpher.sql.validation.SchemaValidator;
import com.enterprise.morpher.sql.validation.SchemaValidator.SchemaProblem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Validates a {@link MigrationSpec} and turns it into a {@link MigrationPlan}.
 * Every check runs here, so a definition that cannot run fails before any row moves.
 */
public class MigrationPlanner {

    private final JoinGraphBuilder joinGraphBuilder;
    private final QueryCompiler queryCompiler;

    public MigrationPlanner() {
        this(new JoinGraphBuilder(), new QueryCompiler());
    }

    public MigrationPlanner(JoinGraphBuilder joinGraphBuilder, QueryCompiler queryCompiler) {
        this.joinGraphBuilder = joinGraphBuilder;
        this.queryCompiler = queryCompiler;
    }

    /**
     * @param sourceDialect  dialect of the read query
     * @param targetDialect  dialect of the writes, decides whether upserts are possible
     * @param sourceColumns  column lookup of the source schema, or {@code null} to skip the schema check
     * @throws ConfigException naming the migration and the reason it cannot run
     */
    public MigrationPlan plan(MigrationSpec spec, TransformRegistry registry, int pageSize,
                              SqlDialect sourceDialect, SqlDialect targetDialect,
                              Function<String, Set<String>> sourceColumns) {
        try {
            return doPlan(spec, registry, pageSize, sourceDialect, targetDialect, sourceColumns);
        } catch (ConfigException e) {
            throw e.inMigration(spec.name());
        }
    }

    private MigrationPlan doPlan(MigrationSpec spec, TransformRegistry registry, int pageSize,
                                 SqlDialect sourceDialect, SqlDialect targetDialect,
                                 Function<String, Set<String>> sourceColumns) {
        if (spec.columnMapping().isEmpty()) {
            throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE, "No columns mapped");
        }
        JoinPlan joinPlan = joinGraphBuilder.build(spec.rootTable(), spec.joins());

        List<QualifiedColumn> sourceRefs = parseColumns(new ArrayList<>(spec.columnMapping().keySet()));
        checkSourceColumns(sourceRefs);
        List<QualifiedColumn> orderBy = parseColumns(spec.orderBy());
        checkTargetColumns(spec);
        checkWriteMode(spec, targetDialect);
        CompiledQuery query = queryCompiler.compile(joinPlan, sourceRefs, orderBy, pageSize, sourceDialect);
        if (sourceColumns != null) {
            checkSchema(joinPlan, sourceRefs, orderBy, sourceColumns);
        }
        RowTransform transform = spec.hasTransform() ? registry.resolve(spec.transformFunction()) : null;
        Map<String, String> columnMapping = new LinkedHashMap<>();
        List<String> targets = spec.targetColumns();
        for (int i = 0; i < sourceRefs.size(); i++) {
            columnMapping.put(sourceRefs.get(i).ref(), targets.get(i));
        }
        return new MigrationPlan(spec, joinPlan, query, columnMapping, transform);
    }

    private static List<QualifiedColumn> parseColumns(List<String> references) {
        List<QualifiedColumn> columns = new ArrayList<>();
        for (String reference : references) {
            try {
                columns.add(QualifiedColumn.parse(reference));
            } catch (IllegalArgumentException e) {
                throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE, e.getMessage(), e);
            }
        }
        return columns;
    }

    private static void checkSourceColumns(List<QualifiedColumn> sourceRefs) {
        Set<String> seen = new HashSet<>();
        for (QualifiedColumn column : sourceRefs) {
            if (!seen.add(column.ref().toLowerCase(Locale.ROOT))) {
                throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE,
                        "Source column '" + column + "' is mapped more than once");
            }
        }
    }

    private static void checkTargetColumns(MigrationSpec spec) {
        try {
            ExpressionValidator.validateIdentifier(spec.targetTable());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(Reason.INVALID_EXPRESSION, "Target table: " + e.getMessage(), e);
        }
        Set<String> seen = new HashSet<>();
        for (String column : spec.columnMapping().values()) {
            try {
                ExpressionValidator.validateIdentifier(column);
            } catch (IllegalArgumentException e) {
                throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE, "Target column: " + e.getMessage(), e);
            }
            if (!seen.add(column.toLowerCase(Locale.ROOT))) {
                throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE,
                        "Target column '" + column + "' is mapped more than once");
            }
        }
    }

    private static void checkWriteMode(MigrationSpec spec, SqlDialect targetDialect) {
        if (spec.writeMode() != WriteMode.UPSERT) {
            return;
        }
        if (spec.keyColumns().isEmpty()) {
            throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE, "UPSERT requires key columns");
        }
        List<String> targets = spec.targetColumns();
        for (String key : spec.keyColumns()) {
            if (!targets.contains(key)) {
                throw new ConfigException(Reason.INVALID_COLUMN_REFERENCE,
                        "Key column '" + key + "' is not a mapped target column: " + targets);
            }
        }
        if (targetDialect.upsertStyle() == UpsertStyle.NONE) {
            throw new ConfigException(Reason.UNSUPPORTED_WRITE_MODE,
                    "UPSERT is not supported by " + targetDialect.name());
        }
    }

    private static void checkSchema(JoinPlan joinPlan, List<QualifiedColumn> sourceRefs,
                                    List<QualifiedColumn> orderBy, Function<String, Set<String>> sourceColumns) {
        Map<String, Set<String>> required = new LinkedHashMap<>();
        joinPlan.tables().forEach(table -> required.put(table.toLowerCase(Locale.ROOT), new LinkedHashSet<>()));
        List<QualifiedColumn> referenced = new ArrayList<>(sourceRefs);
        referenced.addAll(orderBy);
        for (JoinSpec join : joinPlan.joins()) {
            referenced.addAll(JoinGraphBuilder.referencedColumns(join.onClause()));
        }
        for (QualifiedColumn column : referenced) {
            required.computeIfAbsent(column.table().toLowerCase(Locale.ROOT), t -> new LinkedHashSet<>())
                    .add(column.column());
        }
        List<SchemaProblem> problems = new SchemaValidator(sourceColumns).validate(required);
        if (problems.isEmpty()) {
            return;
        }
        SchemaProblem first = problems.get(0);
        throw new ConfigException(
                first.missingTable() ? Reason.BROKEN_JOIN_GRAPH : Reason.INVALID_COLUMN_REFERENCE,
                first.message() + (problems.size() > 1 ? " (and " + (problems.size() - 1) + " more)" : ""));
    }
}
