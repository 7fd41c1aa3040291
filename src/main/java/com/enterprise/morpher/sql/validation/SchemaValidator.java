package com.enterprise.morpher.sql.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validates table and column references against the live schema of a database.
 *
 * <p>The lookup returns the column names of a table, or an empty set when the
 * table does not exist. Names compare case-insensitively.</p>
 */
public class SchemaValidator {

    private final Function<String, Set<String>> columnLookup;

    public SchemaValidator(Function<String, Set<String>> columnLookup) {
        this.columnLookup = columnLookup;
    }

    /**
     * @param columnsByTable table name to the columns that must exist in it
     * @return every missing table or column, in the order given
     */
    public List<SchemaProblem> validate(Map<String, ? extends Collection<String>> columnsByTable) {
        List<SchemaProblem> problems = new ArrayList<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : columnsByTable.entrySet()) {
            validateTable(entry.getKey(), entry.getValue(), problems);
        }
        return problems;
    }

    private void validateTable(String table, Collection<String> columns, List<SchemaProblem> problems) {
        Set<String> dbColumns = columnLookup.apply(table).stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        if (dbColumns.isEmpty()) {
            problems.add(new SchemaProblem(table, null,
                    "Table '" + table + "' not found in database"));
            return;
        }
        for (String column : columns) {
            if (!dbColumns.contains(column.toLowerCase(Locale.ROOT))) {
                problems.add(new SchemaProblem(table, column,
                        "Column '" + column + "' not found in table '" + table + "'"));
            }
        }
    }

    /**
     * A missing table ({@code column == null}) or a missing column.
     */
    public record SchemaProblem(String table, String column, String message) {
        public boolean missingTable() {
            return column == null;
        }
    }
}
