package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ConfigException;
import com.enterprise.morpher.migration.domain.ConfigException.Reason;
import com.enterprise.morpher.migration.domain.JoinSpec;
import com.enterprise.morpher.sql.core.QualifiedColumn;
import com.enterprise.morpher.sql.validation.ExpressionValidator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates that a root table and its joins form a tree.
 *
 * <p>A join's ON clause may reference the root, any table joined before it and the
 * joined table itself, and must reference at least one table already reachable.
 * References are found by scanning for {@code qualifier.column} tokens outside
 * string literals; only the qualifier counts, so a column named
 * {@code countries_id} never refers to the table {@code countries}.
 */
public class JoinGraphBuilder {

    private static final Pattern QUALIFIED_REF = Pattern.compile(
            "(?<![\\w$.])([A-Za-z_][\\w$]*(?:\\.[A-Za-z_][\\w$]*)*)\\.([A-Za-z_][\\w$]*)");

    public JoinPlan build(String rootTable, List<JoinSpec> joins) {
        checkIdentifier(rootTable);
        Set<String> reachable = new LinkedHashSet<>();
        reachable.add(normalize(rootTable));

        for (JoinSpec join : joins) {
            checkIdentifier(join.table());
            String joined = normalize(join.table());
            if (reachable.contains(joined)) {
                throw new ConfigException(Reason.DUPLICATE_JOIN_TARGET,
                        "Table '" + join.table() + "' is joined more than once");
            }
            try {
                ExpressionValidator.validateExpression(join.onClause());
            } catch (IllegalArgumentException e) {
                throw new ConfigException(Reason.INVALID_EXPRESSION,
                        "ON clause of join '" + join.table() + "' rejected: " + e.getMessage(), e);
            }

            Set<String> referenced = referencedTables(join.onClause());
            if (referenced.isEmpty()) {
                throw new ConfigException(Reason.BROKEN_JOIN_GRAPH,
                        "ON clause of join '" + join.table() + "' references no table: " + join.onClause());
            }
            boolean connected = false;
            for (String table : referenced) {
                if (reachable.contains(table)) {
                    connected = true;
                } else if (!table.equals(joined)) {
                    throw new ConfigException(Reason.BROKEN_JOIN_GRAPH,
                            "ON clause of join '" + join.table() + "' references '" + table
                                    + "', which is not joined before it");
                }
            }
            if (!connected) {
                throw new ConfigException(Reason.BROKEN_JOIN_GRAPH,
                        "Join '" + join.table() + "' is not connected to " + reachable);
            }
            reachable.add(joined);
        }
        return new JoinPlan(rootTable, joins);
    }

    /**
     * Lower-cased qualifiers of every {@code qualifier.column} token in the clause.
     */
    static Set<String> referencedTables(String onClause) {
        Set<String> tables = new LinkedHashSet<>();
        referencedColumns(onClause).forEach(column -> tables.add(normalize(column.table())));
        return tables;
    }

    /**
     * Every {@code qualifier.column} token of the clause outside string literals,
     * in clause order.
     */
    static List<QualifiedColumn> referencedColumns(String onClause) {
        List<QualifiedColumn> columns = new ArrayList<>();
        Matcher m = QUALIFIED_REF.matcher(ExpressionValidator.blankLiterals(onClause));
        while (m.find()) {
            columns.add(new QualifiedColumn(m.group(1), m.group(2)));
        }
        return columns;
    }

    private static void checkIdentifier(String table) {
        try {
            ExpressionValidator.validateIdentifier(table);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(Reason.INVALID_EXPRESSION, e.getMessage(), e);
        }
    }

    private static String normalize(String table) {
        return table.toLowerCase(Locale.ROOT);
    }
}
