package io.github.cyfko.eligian.core.model.engine;

import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.List;

/**
 * Engine form of a reusable action definition.
 *
 * @param id              unique identifier
 * @param name            action name
 * @param startOperations operations run when the action starts
 * @param endOperations   operations run when the action ends
 */
public record ActionConfiguration(
        String id,
        String name,
        List<OperationConfiguration> startOperations,
        List<OperationConfiguration> endOperations) {

    public ActionConfiguration {
        startOperations = CollectionUtils.immutableList(startOperations);
        endOperations = CollectionUtils.immutableList(endOperations);
    }
}
