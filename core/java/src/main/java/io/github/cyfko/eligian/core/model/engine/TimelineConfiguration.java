package io.github.cyfko.eligian.core.model.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.List;

/**
 * Engine form of a timeline.
 *
 * @param id              unique identifier
 * @param uri             media URI, omitted for {@code raf}
 * @param type            provider name
 * @param duration        total duration
 * @param loop            whether playback loops
 * @param selector        timeline container selector
 * @param timelineActions resolved actions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimelineConfiguration(
        String id,
        String uri,
        String type,
        Number duration,
        boolean loop,
        String selector,
        List<TimelineActionConfiguration> timelineActions) {

    public TimelineConfiguration {
        timelineActions = CollectionUtils.immutableList(timelineActions);
    }
}
