package com.enterprise.morpher.sql.builder;

import com.enterprise.morpher.sql.param.SqlLiteralFormatter;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A statement with named parameters, ready for {@code NamedParameterJdbcTemplate}.
 */
public class SqlResult {

    // ":name" but not the "::" cast operator
    private static final Pattern NAMED_PARAMETER = Pattern.compile("(?<!:):(\\w+)");

    private final String sql;
    private final Map<String, Object> parameters;

    public SqlResult(String sql, Map<String, Object> parameters) {
        this.sql = sql;
        this.parameters = parameters;
    }

    public String sql() { return sql; }

    public Map<String, Object> namedParameters() { return parameters; }

    /**
     * The SQL with every bound value inlined as a literal. For logs only: the
     * inlined text is never executed.
     */
    public String toDebugString() {
        String inlined = sql;
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            // \b keeps :id_1 from matching inside :id_10
            inlined = inlined.replaceAll(":" + Pattern.quote(entry.getKey()) + "\\b",
                    Matcher.quoteReplacement(SqlLiteralFormatter.format(entry.getValue())));
        }
        return inlined;
    }

    /** Verifies every :param in the SQL has a matching entry in the map. */
    public void verify() {
        Matcher m = NAMED_PARAMETER.matcher(sql);
        while (m.find()) {
            String name = m.group(1);
            if (!parameters.containsKey(name)) {
                throw new IllegalStateException(
                        "SQL references :" + name + " but no parameter was bound");
            }
        }
    }

    @Override
    public String toString() {
        return sql;
    }
}
