package io.github.cyfko.eligian.core.model;

import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.List;

/**
 * One independent playback track.
 * <p>
 * The {@code duration} is derived, never authored: it is the largest literal end time among the
 * timeline's actions, and it is recomputed by every stage that rewrites the action list.
 * </p>
 *
 * @param id       unique identifier
 * @param provider time source
 * @param source   media URI, {@code null} for {@link TimelineProvider#RAF}
 * @param duration computed total duration
 * @param loop     whether playback restarts at the end
 * @param selector container selector of the timeline
 * @param actions  timeline actions in declaration order
 * @param location source span of the timeline declaration
 */
public record Timeline(
        String id,
        TimelineProvider provider,
        String source,
        double duration,
        boolean loop,
        String selector,
        List<TimelineAction> actions,
        SourceLocation location) {

    public Timeline {
        actions = CollectionUtils.immutableList(actions);
        location = location == null ? SourceLocation.unknown() : location;
    }

    /**
     * Replaces the actions and recomputes the derived duration.
     *
     * @param actions the new action list
     * @return a new timeline
     */
    public Timeline withActions(List<TimelineAction> actions) {
        return new Timeline(id, provider, source, computeDuration(actions), loop, selector, actions, location);
    }

    /**
     * Computes the largest literal end time of the given actions; non-literal ends count as zero.
     *
     * @param actions actions to inspect
     * @return the derived duration, {@code 0} for an empty list
     */
    public static double computeDuration(List<TimelineAction> actions) {
        double max = 0d;
        for (TimelineAction action : actions) {
            if (action.duration() != null && action.duration().end() instanceof TimeExpression.Literal literal
                    && literal.value() > max) {
                max = literal.value();
            }
        }
        return max;
    }
}
