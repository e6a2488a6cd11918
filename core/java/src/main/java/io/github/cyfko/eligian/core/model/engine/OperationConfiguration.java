package io.github.cyfko.eligian.core.model.engine;

import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.Map;

/**
 * Engine form of an operation; {@code operationData} holds plain JSON values only.
 *
 * @param id            unique identifier
 * @param systemName    engine operation name
 * @param operationData flattened arguments
 */
public record OperationConfiguration(String id, String systemName, Map<String, Object> operationData) {

    public OperationConfiguration {
        operationData = CollectionUtils.immutableMap(operationData);
    }
}
