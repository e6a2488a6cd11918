package io.github.cyfko.eligian.core.model;

import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.List;

/**
 * Named, reusable bundle of start and end operations.
 * <p>
 * Definitions are independent of timelines; timeline actions invoke them by name through the
 * {@code requestAction}/{@code startAction}/{@code endAction} operation sequence.
 * </p>
 *
 * @param id              unique identifier
 * @param name            action name
 * @param parameters      typed parameters in declaration order
 * @param startOperations operations run when the action starts
 * @param endOperations   operations run when the action ends
 * @param location        source span of the definition
 */
public record ActionDefinition(
        String id,
        String name,
        List<Parameter> parameters,
        List<Operation> startOperations,
        List<Operation> endOperations,
        SourceLocation location) {

    public ActionDefinition {
        parameters = CollectionUtils.immutableList(parameters);
        startOperations = CollectionUtils.immutableList(startOperations);
        endOperations = CollectionUtils.immutableList(endOperations);
        location = location == null ? SourceLocation.unknown() : location;
    }

    public ActionDefinition withOperations(List<Operation> startOperations, List<Operation> endOperations) {
        return new ActionDefinition(id, name, parameters, startOperations, endOperations, location);
    }
}
