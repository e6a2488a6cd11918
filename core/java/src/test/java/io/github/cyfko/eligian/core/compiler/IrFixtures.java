package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.config.ConfigurationDefaults;
import io.github.cyfko.eligian.core.model.*;

import java.util.List;
import java.util.Map;

/**
 * Hand-built IR documents for stage tests.
 */
final class IrFixtures {

    private static int counter;

    private IrFixtures() {}

    static TimelineAction action(String name, double start, double end) {
        return action(name, TimeExpression.literal(start), TimeExpression.literal(end));
    }

    static TimelineAction action(String name, TimeExpression start, TimeExpression end, Operation... operations) {
        return new TimelineAction("action-" + name, name, new Duration(start, end),
                List.of(operations), List.of(), SourceLocation.of(1, 1, name.length()));
    }

    static Operation operation(String systemName, Map<String, Object> data) {
        return new Operation("op-" + (++counter), systemName, data, SourceLocation.unknown());
    }

    static Timeline timeline(TimelineAction... actions) {
        List<TimelineAction> list = List.of(actions);
        return new Timeline("timeline-1", TimelineProvider.RAF, null, Timeline.computeDuration(list),
                false, "body", list, SourceLocation.unknown());
    }

    static IrDocument document(Timeline... timelines) {
        ConfigurationDefaults defaults = ConfigurationDefaults.eligius();
        return new IrDocument("doc-1", defaults.engine(), defaults.containerSelector(), defaults.language(),
                defaults.layoutTemplate(), defaults.availableLanguages(), List.of(), List.of(timelines),
                null, SourceLocation.unknown());
    }

    static IrDocument document(TimelineAction... actions) {
        return document(timeline(actions));
    }

    static TimeExpression lit(double value) {
        return TimeExpression.literal(value);
    }

    static TimeExpression var(String name) {
        return TimeExpression.variable(name);
    }

    static TimeExpression bin(BinaryOperator operator, TimeExpression left, TimeExpression right) {
        return TimeExpression.binary(operator, left, right);
    }

    static List<String> names(IrDocument document) {
        return document.timelines().get(0).actions().stream().map(TimelineAction::name).toList();
    }
}
