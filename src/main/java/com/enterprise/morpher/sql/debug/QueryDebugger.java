package com.enterprise.morpher.sql.debug;

import com.enterprise.morpher.sql.builder.SqlResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Formats migration statements for debug logging: the SQL as sent, the same SQL
 * with values inlined, and the bound values grouped by the row that supplied them.
 *
 * <pre>
 * -- batch 2 into 'new_users' (2 rows, 3 parameters)
 * INSERT INTO new_users (id, phone) VALUES (:id_1, :phone_1), (:id_2, NULL)
 * -- inlined: INSERT INTO new_users (id, phone) VALUES (3, '555'), (4, NULL)
 * --   row 1: id=3 (Integer), phone=555 (String)
 * --   row 2: id=4 (Integer)
 * </pre>
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(String label, SqlResult result) {
        Map<String, Object> params = result.namedParameters();
        SortedMap<Integer, List<String>> byRow = groupByRow(params);

        StringBuilder sb = new StringBuilder("-- ").append(label);
        if (params.isEmpty()) {
            sb.append(" (no parameters)\n").append(result.sql());
            return sb.toString();
        }
        sb.append(" (");
        if (!byRow.containsKey(0)) {
            sb.append(byRow.size()).append(byRow.size() == 1 ? " row, " : " rows, ");
        }
        sb.append(params.size()).append(" parameters)\n");
        sb.append(result.sql()).append('\n');
        sb.append("-- inlined: ").append(result.toDebugString());
        byRow.forEach((row, values) -> sb.append("\n--   ")
                .append(row == 0 ? "unnumbered" : "row " + row).append(": ")
                .append(String.join(", ", values)));
        return sb.toString();
    }

    // parameter names end in _<row>; anything else is grouped under 0
    private static SortedMap<Integer, List<String>> groupByRow(Map<String, Object> params) {
        SortedMap<Integer, List<String>> byRow = new TreeMap<>();
        for (Map.Entry<String, Object> e : params.entrySet()) {
            String name = e.getKey();
            int row = 0;
            String column = name;
            int cut = name.lastIndexOf('_');
            if (cut > 0 && cut < name.length() - 1 && name.substring(cut + 1).chars().allMatch(Character::isDigit)) {
                row = Integer.parseInt(name.substring(cut + 1));
                column = name.substring(0, cut);
            }
            Object val = e.getValue();
            String typeName = val != null ? val.getClass().getSimpleName() : "null";
            byRow.computeIfAbsent(row, r -> new ArrayList<>()).add(column + "=" + val + " (" + typeName + ")");
        }
        return byRow;
    }
}
