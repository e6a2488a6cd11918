package io.github.cyfko.eligian.core.model;

import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.Map;

/**
 * A single named instruction for the runtime engine.
 * <p>
 * The compiler treats operations as opaque leaves: their semantics belong to the engine. The
 * values of {@code operationData} are JSON-compatible values ({@link String}, {@link Number},
 * {@link Boolean}, {@code null}, {@link java.util.List}, {@link Map}) or the IR sub-structures
 * {@link TimeExpression} and {@link TargetSelector}, which later stages fold, check and flatten.
 * </p>
 *
 * @param id            unique identifier
 * @param systemName    engine operation name, e.g. {@code showElement}
 * @param operationData ordered key/value arguments
 * @param location      source span of the originating action
 */
public record Operation(String id, String systemName, Map<String, Object> operationData, SourceLocation location) {

    public Operation {
        operationData = CollectionUtils.immutableMap(operationData);
        location = location == null ? SourceLocation.unknown() : location;
    }

    public Operation withOperationData(Map<String, Object> operationData) {
        return new Operation(id, systemName, operationData, location);
    }
}
