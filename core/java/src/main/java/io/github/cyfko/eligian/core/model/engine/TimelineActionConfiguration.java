package io.github.cyfko.eligian.core.model.engine;

import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.List;

/**
 * Engine form of a timeline action, with a numeric time window.
 *
 * @param id              unique identifier
 * @param name            event name
 * @param duration        numeric time window
 * @param startOperations operations run at start
 * @param endOperations   operations run at end
 */
public record TimelineActionConfiguration(
        String id,
        String name,
        DurationConfiguration duration,
        List<OperationConfiguration> startOperations,
        List<OperationConfiguration> endOperations) {

    public TimelineActionConfiguration {
        startOperations = CollectionUtils.immutableList(startOperations);
        endOperations = CollectionUtils.immutableList(endOperations);
    }
}
