package com.enterprise.morpher.migration.domain;

import java.util.Map;

/**
 * A named, caller-supplied row transformation.
 *
 * <p>Receives the source row and the target row already projected through the
 * column mapping, and returns a fragment that overlays the projection: it may
 * override any mapped target column and fill absent ones. Values may be raw
 * objects ({@code null} meaning absent) or {@link FieldValue}s. Returning
 * {@code null} drops the row without an error.
 *
 * <p>Must not depend on shared mutable state.
 */
@FunctionalInterface
public interface RowTransform {

    Map<String, ?> apply(SourceRow source, TargetRow projected) throws Exception;
}
