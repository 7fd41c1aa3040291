package com.enterprise.morpher.migration.application;

import com.enterprise.morpher.migration.domain.ErrorStage;
import com.enterprise.morpher.migration.domain.FieldValue;
import com.enterprise.morpher.migration.domain.RowError;
import com.enterprise.morpher.migration.domain.RowTransform;
import com.enterprise.morpher.migration.domain.SourceRow;
import com.enterprise.morpher.migration.domain.TargetRow;
import com.enterprise.morpher.migration.domain.TransformException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ItemProcessor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@link SourceRow} into a {@link TargetRow}: projects it through the
 * column mapping, then overlays the fragment returned by the optional transform.
 *
 * <p>As an {@link ItemProcessor} it never throws for a bad row: a failing transform
 * is recorded as a {@code TRANSFORM} error and the row is dropped ({@code null}),
 * as is a row the transform filters out.
 */
public class RowTransformProcessor implements ItemProcessor<SourceRow, TargetRow> {

    private static final Logger log = LoggerFactory.getLogger(RowTransformProcessor.class);

    private final Map<String, String> columnMapping;
    private final RowTransform transform;
    private final MigrationRunContext context;

    /**
     * @param transform row transform, or {@code null} for a pure projection
     */
    public RowTransformProcessor(Map<String, String> columnMapping, RowTransform transform,
                                 MigrationRunContext context) {
        this.columnMapping = Collections.unmodifiableMap(new LinkedHashMap<>(columnMapping));
        this.transform = transform;
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public TargetRow process(SourceRow source) {
        try {
            Optional<TargetRow> row = transform(source);
            if (row.isEmpty()) {
                context.rowFiltered();
                return null;
            }
            context.rowTransformed();
            return row.get();
        } catch (TransformException e) {
            log.warn("Transform failed for row {}: {}", e.rowIdentifier(), e.getMessage());
            context.transformFailed(new RowError(ErrorStage.TRANSFORM, e.rowIdentifier(), e.getMessage()));
            return null;
        }
    }

    /**
     * @return the target row, empty when the transform filtered the row out
     * @throws TransformException if the transform raised or returned an unmapped column
     */
    public Optional<TargetRow> transform(SourceRow source) {
        TargetRow projected = project(source);
        if (transform == null) {
            return Optional.of(projected);
        }
        Map<String, ?> fragment;
        try {
            fragment = transform.apply(source, projected);
        } catch (Exception e) {
            throw new TransformException(projected.identifier(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
        if (fragment == null) {
            return Optional.empty();
        }
        Map<String, FieldValue> merged = new LinkedHashMap<>(projected.asMap());
        for (Map.Entry<String, ?> entry : fragment.entrySet()) {
            if (!merged.containsKey(entry.getKey())) {
                throw new TransformException(projected.identifier(),
                        "Transform returned column '" + entry.getKey() + "', which is not a mapped target column");
            }
            merged.put(entry.getKey(), FieldValue.of(entry.getValue()));
        }
        return Optional.of(new TargetRow(merged));
    }

    /** Rename only; absent values stay absent. */
    TargetRow project(SourceRow source) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        columnMapping.forEach((sourceColumn, targetColumn) -> values.put(targetColumn, source.get(sourceColumn)));
        return new TargetRow(values);
    }
}
