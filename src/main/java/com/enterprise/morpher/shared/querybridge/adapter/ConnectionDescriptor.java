package com.enterprise.morpher.shared.querybridge.adapter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where a database lives. File-based engines use {@code path}; server engines use
 * {@code host}, {@code port} and {@code database}. {@code options} are appended
 * to the URL in the engine's own syntax.
 */
public record ConnectionDescriptor(
        String type,
        String host,
        Integer port,
        String database,
        String path,
        Map<String, String> options) {

    public ConnectionDescriptor {
        options = options == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static ConnectionDescriptor server(String type, String host, int port, String database) {
        return new ConnectionDescriptor(type, host, port, database, null, Map.of());
    }

    public static ConnectionDescriptor file(String type, String path) {
        return new ConnectionDescriptor(type, null, null, null, path, Map.of());
    }
}
