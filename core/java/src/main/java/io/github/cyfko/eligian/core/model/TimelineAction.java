package io.github.cyfko.eligian.core.model;

import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.List;

/**
 * A time-bounded unit of work on a timeline.
 * <p>
 * {@code startOperations} run when the window opens and {@code endOperations} when it closes.
 * An action whose concrete window has {@code end <= start} never runs and is removed by the
 * optimizer.
 * </p>
 *
 * @param id              unique identifier
 * @param name            event name from the source
 * @param duration        time window
 * @param startOperations operations run at {@code start}
 * @param endOperations   operations run at {@code end}
 * @param location        source span of the event
 */
public record TimelineAction(
        String id,
        String name,
        Duration duration,
        List<Operation> startOperations,
        List<Operation> endOperations,
        SourceLocation location) {

    public TimelineAction {
        startOperations = CollectionUtils.immutableList(startOperations);
        endOperations = CollectionUtils.immutableList(endOperations);
        location = location == null ? SourceLocation.unknown() : location;
    }

    public TimelineAction withDuration(Duration duration) {
        return new TimelineAction(id, name, duration, startOperations, endOperations, location);
    }

    public TimelineAction withOperations(List<Operation> startOperations, List<Operation> endOperations) {
        return new TimelineAction(id, name, duration, startOperations, endOperations, location);
    }
}
