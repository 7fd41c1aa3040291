package com.enterprise.morpher.shared.querybridge.adapter;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds JDBC URLs from {@link ConnectionDescriptor}s.
 *
 * <p>Supported types: {@code h2}, {@code sqlite}, {@code duckdb}, {@code access},
 * {@code postgresql}, {@code mysql}, {@code oracle}, {@code mssql}, {@code firebird}.
 * File engines without a path open an in-memory database.
 */
public final class JdbcUrlFactory {

    private JdbcUrlFactory() {}

    /**
     * @throws IllegalArgumentException for an unknown type, a port outside 1..65535,
     *                                  or a missing host/database/path
     */
    public static String create(ConnectionDescriptor descriptor) {
        if (descriptor.type() == null) {
            throw new IllegalArgumentException("Database type is required");
        }
        validatePort(descriptor.port());
        String type = descriptor.type().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "h2" -> h2(descriptor);
            case "sqlite" -> "jdbc:sqlite:" + (descriptor.path() != null ? descriptor.path() : ":memory:");
            case "duckdb" -> "jdbc:duckdb:" + (descriptor.path() != null ? descriptor.path() : "");
            case "access" -> "jdbc:ucanaccess://" + required(descriptor.path(), "path", type);
            case "postgresql", "postgres" -> "jdbc:postgresql://" + hostPort(descriptor, 5432)
                    + "/" + required(descriptor.database(), "database", type) + query(descriptor.options());
            case "mysql", "mariadb" -> "jdbc:" + type + "://" + hostPort(descriptor, 3306)
                    + "/" + required(descriptor.database(), "database", type) + query(descriptor.options());
            case "oracle" -> "jdbc:oracle:thin:@//" + hostPort(descriptor, 1521)
                    + "/" + required(descriptor.database(), "database", type);
            case "mssql", "sqlserver" -> "jdbc:sqlserver://" + hostPort(descriptor, 1433)
                    + ";databaseName=" + required(descriptor.database(), "database", type)
                    + semicolonOptions(descriptor.options());
            case "firebird" -> "jdbc:firebirdsql://" + hostPort(descriptor, 3050)
                    + "/" + required(descriptor.path() != null ? descriptor.path() : descriptor.database(),
                    "path", type);
            default -> throw new IllegalArgumentException("Unsupported database type: " + descriptor.type());
        };
    }

    private static String h2(ConnectionDescriptor descriptor) {
        if (descriptor.path() != null) {
            return "jdbc:h2:file:" + descriptor.path() + semicolonOptions(descriptor.options());
        }
        String name = descriptor.database() != null ? descriptor.database() : "";
        // keep named in-memory databases alive between connections
        return "jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1" + semicolonOptions(descriptor.options());
    }

    private static void validatePort(Integer port) {
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
    }

    private static String hostPort(ConnectionDescriptor descriptor, int defaultPort) {
        String host = required(descriptor.host(), "host", descriptor.type());
        int port = descriptor.port() != null ? descriptor.port() : defaultPort;
        return host + ":" + port;
    }

    private static String required(String value, String field, String type) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required for " + type);
        }
        return value;
    }

    private static String query(Map<String, String> options) {
        if (options.isEmpty()) {
            return "";
        }
        return options.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&", "?", ""));
    }

    private static String semicolonOptions(Map<String, String> options) {
        return options.entrySet().stream()
                .map(e -> ";" + e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining());
    }
}
