package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.exception.TypeCheckException;
import io.github.cyfko.eligian.core.model.*;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Verifies the value constraints of an {@link IrDocument}, whatever produced it.
 * <p>
 * The check stops at the first violation. Traversal order is fixed: the document, then each
 * timeline, its actions in declared order and their operations in declared order (start before
 * end), then the action definitions.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class TypeChecker {

    private static final Logger log = Logger.getLogger(TypeChecker.class.getName());

    private static final String DURATION_KEY = "duration";
    private static final String ANIMATION_ARGS_KEY = "animationArgs";

    /**
     * @param document the document to check
     * @return {@code document} itself when it is well typed
     * @throws TypeCheckException on the first violation
     */
    public IrDocument check(IrDocument document) {
        SourceLocation documentLocation = document.location();
        requireText(document.id(), "Document id", documentLocation);
        if (document.containerSelector() == null) {
            throw new TypeCheckException("Document containerSelector must be a string", documentLocation, "string", "null");
        }
        if (document.language() == null) {
            throw new TypeCheckException("Document language must be a string", documentLocation, "string", "null");
        }
        if (document.timelines().isEmpty()) {
            throw new TypeCheckException("Document must contain at least one timeline", documentLocation,
                    "timeline", "none");
        }

        for (Timeline timeline : document.timelines()) {
            checkTimeline(timeline);
        }
        for (ActionDefinition definition : document.actions()) {
            requireText(definition.name(), "Action definition name", definition.location());
            checkOperations(definition.startOperations());
            checkOperations(definition.endOperations());
        }

        log.fine(() -> String.format("Type checked %d timeline(s) and %d action definition(s)",
                document.timelines().size(), document.actions().size()));
        return document;
    }

    private void checkTimeline(Timeline timeline) {
        SourceLocation location = timeline.location();
        if (timeline.provider() == null) {
            throw new TypeCheckException("Invalid timeline provider: null", location, "raf | video | audio", "null");
        }
        if (timeline.source() != null && timeline.source().isBlank()) {
            throw new TypeCheckException("Timeline source must be a non-empty string", location, "string", "\"\"");
        }
        if (timeline.provider().isSourceRequired() && timeline.source() == null) {
            throw new TypeCheckException(
                    String.format("Timeline source must be a string for provider '%s'", timeline.provider().systemName()),
                    location, "string", "null");
        }

        for (TimelineAction action : timeline.actions()) {
            Duration duration = action.duration();
            if (duration == null || duration.start() == null || duration.end() == null) {
                throw new TypeCheckException(
                        String.format("Timeline action '%s' has no duration", action.name()),
                        action.location(), "duration", "null");
            }
            checkTime(duration.start(), "Action start", action.location());
            checkTime(duration.end(), "Action end", action.location());
            checkOperations(action.startOperations());
            checkOperations(action.endOperations());
        }
    }

    private void checkTime(TimeExpression expression, String what, SourceLocation location) {
        if (expression instanceof TimeExpression.Literal literal) {
            if (!Double.isFinite(literal.value())) {
                throw new TypeCheckException(what + " must be a number", location, "number",
                        String.valueOf(literal.value()));
            }
        } else if (expression instanceof TimeExpression.Binary binary) {
            if (binary.operator() == null) {
                throw new TypeCheckException("Invalid binary operator", location, "+ | - | * | /", "null");
            }
            checkTime(binary.left(), what, location);
            checkTime(binary.right(), what, location);
        } else if (expression == null) {
            throw new TypeCheckException(what + " must be a number", location, "number", "null");
        }
    }

    // ========== Operations ==========

    private void checkOperations(List<Operation> operations) {
        for (Operation operation : operations) {
            requireText(operation.systemName(), "Operation systemName", operation.location());
            for (Map.Entry<String, Object> entry : operation.operationData().entrySet()) {
                String path = operation.systemName() + "." + entry.getKey();
                Object value = entry.getValue();
                switch (entry.getKey()) {
                    case DURATION_KEY -> checkNonNegative(value, "duration", path, operation.location());
                    case ANIMATION_ARGS_KEY -> checkAnimationArgs(value, path, operation.location());
                    default -> checkValue(value, path, operation.location());
                }
            }
        }
    }

    private void checkAnimationArgs(Object value, String path, SourceLocation location) {
        if (!(value instanceof List<?> args)) {
            throw new TypeCheckException(path + " must be a list", location, "list", describe(value));
        }
        for (int i = 0; i < args.size(); i++) {
            Object arg = args.get(i);
            if (arg instanceof Number || arg instanceof TimeExpression) {
                checkNonNegative(arg, "animationArgs[" + i + "]", path, location);
            } else {
                checkValue(arg, path + "[" + i + "]", location);
            }
        }
    }

    private void checkNonNegative(Object value, String name, String path, SourceLocation location) {
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof TimeExpression.Literal literal) {
            number = literal.value();
        } else if (value instanceof TimeExpression expression) {
            checkTime(expression, path, location);
            if (!(ConstantFolder.foldConservatively(expression) instanceof TimeExpression.Literal folded)) {
                // still references a variable
                return;
            }
            number = folded.value();
        } else {
            throw new TypeCheckException(
                    String.format("%s: %s must be a number", path, name), location, "number", describe(value));
        }
        if (!Double.isFinite(number)) {
            throw new TypeCheckException(
                    String.format("%s: %s must be a number", path, name), location, "number", String.valueOf(number));
        }
        if (number < 0) {
            throw new TypeCheckException(
                    String.format("%s: %s must be non-negative", path, name), location, ">= 0", String.valueOf(number));
        }
    }

    private void checkValue(Object value, String path, SourceLocation location) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return;
        }
        if (value instanceof Number number) {
            if (!Double.isFinite(number.doubleValue())) {
                throw new TypeCheckException(path + " must be a number", location, "number", String.valueOf(number));
            }
        } else if (value instanceof TimeExpression expression) {
            checkTime(expression, path, location);
        } else if (value instanceof TargetSelector selector) {
            checkSelector(selector, path);
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                checkValue(list.get(i), path + "[" + i + "]", location);
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                checkValue(entry.getValue(), path + "." + entry.getKey(), location);
            }
        } else {
            throw new TypeCheckException(path + " has an unsupported value type", location,
                    "string | number | boolean | selector | time expression | list | map", describe(value));
        }
    }

    private void checkSelector(TargetSelector selector, String path) {
        if (selector.kind() == null) {
            throw new TypeCheckException("Invalid target selector kind at " + path, selector.location(),
                    "id | class | element | query", "null");
        }
        if (selector.value() == null || selector.value().isBlank()) {
            throw new TypeCheckException("Target selector value must be a string at " + path, selector.location(),
                    "string", describe(selector.value()));
        }
    }

    private static void requireText(String value, String what, SourceLocation location) {
        if (value == null || value.isBlank()) {
            throw new TypeCheckException(what + " must be a non-empty string", location, "string", describe(value));
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
