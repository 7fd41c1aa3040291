package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.FieldValue;
import com.enterprise.morpher.migration.domain.SourceRow;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.JdbcUtils;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a result row to a {@link SourceRow} keyed by qualified column.
 *
 * <p>Columns are located by alias, case-insensitively; when the driver does not
 * report the alias the select-list position is used. SQL NULL becomes
 * {@link FieldValue#absent()}. Not thread-safe: use one instance per reader.
 */
public class SourceRowMapper implements RowMapper<SourceRow> {

    private final List<SelectedColumn> columns;
    private int[] indexes;

    public SourceRowMapper(List<SelectedColumn> columns) {
        this.columns = List.copyOf(columns);
    }

    @Override
    public SourceRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        if (rowNum == 0 || indexes == null) {
            indexes = resolveIndexes(rs.getMetaData());
        }
        Map<String, FieldValue> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Object value = JdbcUtils.getResultSetValue(rs, indexes[i]);
            values.put(columns.get(i).source().ref(), FieldValue.of(value));
        }
        return new SourceRow(values);
    }

    private int[] resolveIndexes(ResultSetMetaData meta) throws SQLException {
        Map<String, Integer> byLabel = new HashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            byLabel.putIfAbsent(JdbcUtils.lookupColumnName(meta, i).toLowerCase(Locale.ROOT), i);
        }
        int[] resolved = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            resolved[i] = byLabel.getOrDefault(columns.get(i).alias().toLowerCase(Locale.ROOT), i + 1);
        }
        return resolved;
    }
}
