package com.enterprise.morpher.sql.param;

import java.math.BigDecimal;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.HexFormat;

/**
 * Renders the values a JDBC driver hands back as SQL literals, for the
 * values-inlined form of logged statements. Statements sent to a database
 * always bind values instead.
 */
public final class SqlLiteralFormatter {

    private SqlLiteralFormatter() {}

    /**
     * Formats a value read from or written to a JDBC column. Types without a
     * literal syntax of their own are rendered as a quoted {@code toString()}.
     */
    public static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof byte[] bytes) {
            return "X'" + HexFormat.of().withUpperCase().formatHex(bytes) + "'";
        }
        // java.sql.Date and Timestamp extend java.util.Date, check them first
        if (value instanceof java.sql.Date d) {
            return date(d.toLocalDate());
        }
        if (value instanceof Timestamp ts) {
            return timestamp(ts.toLocalDateTime());
        }
        if (value instanceof Time t) {
            return "TIME '" + t.toLocalTime() + "'";
        }
        if (value instanceof LocalDate ld) {
            return date(ld);
        }
        if (value instanceof LocalDateTime ldt) {
            return timestamp(ldt);
        }
        if (value instanceof LocalTime lt) {
            return "TIME '" + lt + "'";
        }
        if (value instanceof OffsetDateTime odt) {
            return "TIMESTAMP WITH TIME ZONE '" + odt.toString().replace('T', ' ') + "'";
        }
        return quote(value.toString());
    }

    private static String date(LocalDate date) {
        return "DATE '" + date + "'";
    }

    private static String timestamp(LocalDateTime dateTime) {
        return "TIMESTAMP '" + dateTime.toString().replace('T', ' ') + "'";
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
