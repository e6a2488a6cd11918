package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.model.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Rewrites an {@link IrDocument} in two passes: constant folding, then dead-code elimination.
 * <p>
 * Folding applies to action durations and to time expressions inside operation data, in
 * timelines and in action definitions. Elimination then drops every timeline action whose
 * bounds are both literal and either {@code end <= start} or {@code start < 0}; actions with an
 * unresolved bound are kept. Retained actions keep their order and each timeline duration is
 * recomputed.
 * </p>
 * <p>
 * The input is never modified and no list or map of the result is shared with it.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class Optimizer {

    private static final Logger log = Logger.getLogger(Optimizer.class.getName());

    private final boolean partialFolding;

    public Optimizer() {
        this(false);
    }

    /**
     * @param partialFolding fold literal sub-trees below a variable as well
     */
    public Optimizer(boolean partialFolding) {
        this.partialFolding = partialFolding;
    }

    public IrDocument optimize(IrDocument document) {
        ConstantFolder folder = new ConstantFolder(partialFolding);
        int removed = 0;

        List<Timeline> timelines = new ArrayList<>(document.timelines().size());
        for (Timeline timeline : document.timelines()) {
            List<TimelineAction> kept = new ArrayList<>();
            for (TimelineAction action : timeline.actions()) {
                TimelineAction folded = foldAction(action, folder);
                if (isDead(folded.duration())) {
                    removed++;
                    continue;
                }
                kept.add(folded);
            }
            timelines.add(timeline.withActions(kept));
        }

        List<ActionDefinition> definitions = new ArrayList<>(document.actions().size());
        for (ActionDefinition definition : document.actions()) {
            definitions.add(definition.withOperations(
                    foldOperations(definition.startOperations(), folder),
                    foldOperations(definition.endOperations(), folder)));
        }

        int removedActions = removed;
        log.fine(() -> String.format("Optimizer folded %d expression(s) and removed %d action(s)",
                folder.foldedCount(), removedActions));

        return document.withTimelines(timelines).withActions(definitions);
    }

    /**
     * @return whether an action with this duration never runs
     */
    public static boolean isDead(Duration duration) {
        if (duration == null
                || !(duration.start() instanceof TimeExpression.Literal start)
                || !(duration.end() instanceof TimeExpression.Literal end)) {
            return false;
        }
        return end.value() <= start.value() || start.value() < 0;
    }

    private TimelineAction foldAction(TimelineAction action, ConstantFolder folder) {
        Duration duration = action.duration();
        Duration folded = duration == null ? null
                : new Duration(folder.fold(duration.start()), folder.fold(duration.end()));
        return action.withDuration(folded).withOperations(
                foldOperations(action.startOperations(), folder),
                foldOperations(action.endOperations(), folder));
    }

    private static List<Operation> foldOperations(List<Operation> operations, ConstantFolder folder) {
        List<Operation> result = new ArrayList<>(operations.size());
        for (Operation operation : operations) {
            Map<String, Object> data = new LinkedHashMap<>();
            operation.operationData().forEach((key, value) -> data.put(key, folder.foldValue(value)));
            result.add(operation.withOperationData(data));
        }
        return result;
    }
}
