package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.exception.OptimizationException;
import io.github.cyfko.eligian.core.model.*;
import io.github.cyfko.eligian.core.model.engine.*;
import io.github.cyfko.eligian.core.utils.NumberUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects an {@link IrDocument} onto the {@link EngineConfiguration} shape read by the runtime engine.
 * <p>
 * Action bounds must evaluate to numbers. Inside operation data, selectors are flattened to their
 * string form, literal-only expressions become numbers and expressions that still reference a
 * variable are written as {@code $name} / {@code (a op b)} strings.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class ConfigurationResolver {

    public static final String PASS_NAME = "resolve-times";

    /**
     * @throws OptimizationException when an action bound still references a variable
     */
    public EngineConfiguration resolve(IrDocument document) {
        List<TimelineConfiguration> timelines = new ArrayList<>();
        for (Timeline timeline : document.timelines()) {
            timelines.add(resolveTimeline(timeline));
        }

        List<ActionConfiguration> actions = new ArrayList<>();
        for (ActionDefinition definition : document.actions()) {
            actions.add(new ActionConfiguration(
                    definition.id(),
                    definition.name(),
                    resolveOperations(definition.startOperations()),
                    resolveOperations(definition.endOperations())));
        }

        return new EngineConfiguration(
                document.id(),
                document.engine(),
                document.containerSelector(),
                document.language(),
                document.layoutTemplate(),
                document.availableLanguages(),
                List.of(),
                List.of(),
                actions,
                List.of(),
                timelines,
                null,
                null,
                document.metadata());
    }

    private TimelineConfiguration resolveTimeline(Timeline timeline) {
        List<TimelineActionConfiguration> actions = new ArrayList<>();
        double duration = 0d;
        for (TimelineAction action : timeline.actions()) {
            double start = resolveBound(action.duration().start(), action, "start");
            double end = resolveBound(action.duration().end(), action, "end");
            duration = Math.max(duration, end);
            actions.add(new TimelineActionConfiguration(
                    action.id(),
                    action.name(),
                    new DurationConfiguration(NumberUtils.normalize(start), NumberUtils.normalize(end)),
                    resolveOperations(action.startOperations()),
                    resolveOperations(action.endOperations())));
        }
        return new TimelineConfiguration(
                timeline.id(),
                timeline.source(),
                timeline.provider().systemName(),
                NumberUtils.normalize(duration),
                timeline.loop(),
                timeline.selector(),
                actions);
    }

    private static double resolveBound(TimeExpression expression, TimelineAction action, String bound) {
        if (ConstantFolder.foldConservatively(expression) instanceof TimeExpression.Literal literal) {
            return literal.value();
        }
        throw new OptimizationException(
                String.format("Cannot resolve %s time of action '%s': %s references an unbound variable",
                        bound, action.name(), expression.render()),
                PASS_NAME, action.location());
    }

    private static List<OperationConfiguration> resolveOperations(List<Operation> operations) {
        List<OperationConfiguration> result = new ArrayList<>(operations.size());
        for (Operation operation : operations) {
            Map<String, Object> data = new LinkedHashMap<>();
            operation.operationData().forEach((key, value) -> data.put(key, resolveValue(value)));
            result.add(new OperationConfiguration(operation.id(), operation.systemName(), data));
        }
        return result;
    }

    private static Object resolveValue(Object value) {
        if (value instanceof TargetSelector selector) {
            return selector.toSelectorString();
        }
        if (value instanceof TimeExpression expression) {
            TimeExpression folded = ConstantFolder.foldConservatively(expression);
            return folded instanceof TimeExpression.Literal literal
                    ? NumberUtils.normalize(literal.value())
                    : folded.render();
        }
        if (value instanceof Double || value instanceof Float) {
            return NumberUtils.normalize(((Number) value).doubleValue());
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object element : list) {
                result.add(resolveValue(element));
            }
            return Collections.unmodifiableList(result);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> result = new LinkedHashMap<>();
            map.forEach((key, element) -> result.put(key, resolveValue(element)));
            return Collections.unmodifiableMap(result);
        }
        return value;
    }
}
