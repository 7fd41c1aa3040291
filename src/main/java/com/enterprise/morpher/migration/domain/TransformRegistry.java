package com.enterprise.morpher.migration.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Closed, immutable set of named {@link RowTransform}s, handed to the
 * orchestrator per run.
 *
 * <pre>{@code
 * TransformRegistry registry = TransformRegistry.builder()
 *     .register("normalizeUser", (source, projected) -> Map.of("username",
 *         projected.valueOf("username").toString().toLowerCase()))
 *     .build();
 * }</pre>
 */
public final class TransformRegistry {

    private static final TransformRegistry EMPTY = new TransformRegistry(Map.of());

    private final Map<String, RowTransform> transforms;

    private TransformRegistry(Map<String, RowTransform> transforms) {
        this.transforms = Collections.unmodifiableMap(new LinkedHashMap<>(transforms));
    }

    public static TransformRegistry empty() {
        return EMPTY;
    }

    public static TransformRegistry of(Map<String, ? extends RowTransform> transforms) {
        return new TransformRegistry(Map.copyOf(transforms));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws ConfigException {@code UNKNOWN_TRANSFORM} if no function has that name
     */
    public RowTransform resolve(String name) {
        RowTransform transform = transforms.get(name);
        if (transform == null) {
            throw new ConfigException(ConfigException.Reason.UNKNOWN_TRANSFORM,
                    "Transform function '" + name + "' not found in registry. Available: "
                            + transforms.keySet());
        }
        return transform;
    }

    public boolean contains(String name) {
        return transforms.containsKey(name);
    }

    public Set<String> names() {
        return transforms.keySet();
    }

    public static final class Builder {

        private final Map<String, RowTransform> transforms = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String name, RowTransform transform) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(transform, "transform");
            if (transforms.putIfAbsent(name, transform) != null) {
                throw new IllegalArgumentException("Transform already registered: " + name);
            }
            return this;
        }

        public TransformRegistry build() {
            return new TransformRegistry(transforms);
        }
    }
}
