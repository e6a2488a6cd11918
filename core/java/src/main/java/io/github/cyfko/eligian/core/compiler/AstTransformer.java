package io.github.cyfko.eligian.core.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.eligian.core.api.CompilationContext;
import io.github.cyfko.eligian.core.ast.EligianAst.*;
import io.github.cyfko.eligian.core.config.ConfigurationDefaults;
import io.github.cyfko.eligian.core.config.OperationRegistry;
import io.github.cyfko.eligian.core.config.OperationSignature;
import io.github.cyfko.eligian.core.exception.TransformErrorKind;
import io.github.cyfko.eligian.core.exception.TransformException;
import io.github.cyfko.eligian.core.model.*;
import io.github.cyfko.eligian.core.utils.LocationUtils;
import io.github.cyfko.eligian.core.utils.NumberUtils;

import java.util.*;
import java.util.logging.Logger;

/**
 * Transforms an Eligian syntax tree into an {@link IrDocument}.
 * <p>
 * Time ranges are kept as {@link TimeExpression}s; evaluating them is the optimizer's job.
 * Every document, timeline, action and operation receives a fresh identifier from the
 * {@link CompilationContext}, which is the only side effect of this stage.
 * </p>
 *
 * <h2>Action mapping</h2>
 * <ul>
 *   <li>{@code show}/{@code hide}/{@code animate} become {@code showElement}/{@code hideElement}/{@code animateElement}
 *       with {@code selector}, {@code animation} and {@code animationArgs}</li>
 *   <li>{@code trigger} becomes {@code triggerAction} with {@code actionName} and an optional {@code selector}</li>
 *   <li>{@code call} expands to {@code requestAction} + {@code startAction} when the window opens and
 *       {@code requestAction} + {@code endAction} when it closes</li>
 *   <li>{@code op} is passed through with its properties as operation data, once its name and
 *       required keys are found in the {@link OperationRegistry}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class AstTransformer {

    private static final Logger log = Logger.getLogger(AstTransformer.class.getName());
    private static final ObjectMapper NODE_WRITER = new ObjectMapper();

    public static final String SHOW_ELEMENT = "showElement";
    public static final String HIDE_ELEMENT = "hideElement";
    public static final String ANIMATE_ELEMENT = "animateElement";
    public static final String TRIGGER_ACTION = "triggerAction";
    public static final String REQUEST_ACTION = "requestAction";
    public static final String START_ACTION = "startAction";
    public static final String END_ACTION = "endAction";

    static final int MAX_SUGGESTIONS = 3;

    private final ConfigurationDefaults defaults;
    private final OperationRegistry operations;

    public AstTransformer(ConfigurationDefaults defaults) {
        this(defaults, OperationRegistry.eligius());
    }

    public AstTransformer(ConfigurationDefaults defaults, OperationRegistry operations) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.operations = Objects.requireNonNull(operations, "operations");
    }

    /**
     * @param program parsed program
     * @param context per-compilation context supplying identifiers and the source file
     * @return the IR document, without metadata
     * @throws TransformException when the tree cannot be transformed
     */
    public IrDocument transform(Program program, CompilationContext context) {
        Objects.requireNonNull(program, "program");
        Scope scope = new Scope(context, program);

        TimelineDeclaration declaration = findTimeline(program, scope);
        String documentId = context.nextId();
        Timeline timeline = transformTimeline(declaration, program, scope);

        List<ActionDefinition> definitions = new ArrayList<>();
        for (Element element : program.elements()) {
            if (element instanceof ActionDeclaration action) {
                definitions.add(transformDefinition(action, scope));
            } else if (!(element instanceof TimelineDeclaration) && !(element instanceof EventDeclaration)) {
                throw new TransformException(TransformErrorKind.INVALID_ACTION,
                        "Unknown program element: " + element.getClass().getSimpleName(),
                        scope.locate(element), serialize(element));
            }
        }

        log.fine(() -> String.format("Transformed %d timeline action(s) and %d action definition(s)",
                timeline.actions().size(), definitions.size()));

        return new IrDocument(
                documentId,
                defaults.engine(),
                defaults.containerSelector(),
                defaults.language(),
                defaults.layoutTemplate(),
                defaults.availableLanguages(),
                definitions,
                List.of(timeline),
                null,
                scope.locate(program));
    }

    // ========== Timeline ==========

    private TimelineDeclaration findTimeline(Program program, Scope scope) {
        TimelineDeclaration found = null;
        for (Element element : program.elements()) {
            if (element instanceof TimelineDeclaration declaration) {
                if (found != null) {
                    throw new TransformException(TransformErrorKind.INVALID_TIMELINE,
                            "Only one timeline declaration is allowed", scope.locate(declaration));
                }
                found = declaration;
            }
        }
        if (found == null) {
            throw new TransformException(TransformErrorKind.INVALID_TIMELINE,
                    "Program has no timeline declaration", scope.locate(program));
        }
        return found;
    }

    private Timeline transformTimeline(TimelineDeclaration declaration, Program program, Scope scope) {
        TimelineProvider provider = TimelineProvider.fromName(declaration.provider())
                .orElseThrow(() -> new TransformException(TransformErrorKind.INVALID_TIMELINE,
                        String.format("Unknown timeline provider '%s'", declaration.provider()),
                        scope.locate(declaration)));
        String timelineId = scope.context.nextId();

        List<TimelineAction> actions = new ArrayList<>();
        for (Element element : program.elements()) {
            if (element instanceof EventDeclaration event) {
                actions.add(transformEvent(event, scope));
            }
        }

        return new Timeline(
                timelineId,
                provider,
                declaration.source(),
                Timeline.computeDuration(actions),
                false,
                defaults.timelineSelector(),
                actions,
                scope.locate(declaration));
    }

    private TimelineAction transformEvent(EventDeclaration event, Scope scope) {
        TimeRange range = event.timeRange();
        if (range == null || range.start() == null || range.end() == null) {
            throw new TransformException(TransformErrorKind.INVALID_EVENT,
                    String.format("Event '%s' is missing its time range", event.name()), scope.locate(event));
        }
        String id = scope.context.nextId();
        Duration duration = new Duration(transformTime(range.start(), scope), transformTime(range.end(), scope));

        List<Operation> start = new ArrayList<>();
        List<Operation> end = new ArrayList<>();
        for (ActionNode action : event.actions()) {
            transformAction(action, start, end, scope);
        }
        return new TimelineAction(id, event.name(), duration, start, end, scope.locate(event));
    }

    // ========== Action definitions ==========

    private ActionDefinition transformDefinition(ActionDeclaration declaration, Scope scope) {
        String id = scope.context.nextId();
        List<Parameter> parameters = new ArrayList<>();
        for (ParameterNode node : declaration.parameters()) {
            ParameterType type = ParameterType.fromName(node.type())
                    .orElseThrow(() -> new TransformException(TransformErrorKind.INVALID_EXPRESSION,
                            String.format("Unknown parameter type '%s'", node.type()), scope.locate(node)));
            Object defaultValue = node.defaultValue() == null ? null : transformValue(node.defaultValue(), scope);
            parameters.add(new Parameter(node.name(), type, defaultValue, scope.locate(node)));
        }

        List<Operation> start = new ArrayList<>();
        List<Operation> end = new ArrayList<>();
        for (ActionNode action : declaration.startActions()) {
            transformAction(action, start, end, scope);
        }
        // operations of an 'end' block run when the action ends, so everything goes to end
        for (ActionNode action : declaration.endActions()) {
            transformAction(action, end, end, scope);
        }
        return new ActionDefinition(id, declaration.name(), parameters, start, end, scope.locate(declaration));
    }

    // ========== Actions ==========

    private void transformAction(ActionNode action, List<Operation> start, List<Operation> end, Scope scope) {
        SourceLocation location = scope.locate(action);
        if (action instanceof ShowAction show) {
            start.add(scope.operation(SHOW_ELEMENT, elementData(show.target(), show.animation(), scope), location));
        } else if (action instanceof HideAction hide) {
            start.add(scope.operation(HIDE_ELEMENT, elementData(hide.target(), hide.animation(), scope), location));
        } else if (action instanceof AnimateAction animate) {
            start.add(scope.operation(ANIMATE_ELEMENT, elementData(animate.target(), animate.animation(), scope), location));
        } else if (action instanceof TriggerAction trigger) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("actionName", trigger.actionName());
            if (trigger.target() != null) {
                data.put("selector", transformSelector(trigger.target(), scope));
            }
            start.add(scope.operation(TRIGGER_ACTION, data, location));
        } else if (action instanceof ActionCall call) {
            expandCall(call, start, end, scope);
        } else if (action instanceof RawOperation raw) {
            Map<String, Object> data = new LinkedHashMap<>();
            for (PropertyNode property : raw.properties()) {
                data.put(property.key(), transformValue(property.value(), scope));
            }
            checkOperation(raw, data, location);
            start.add(scope.operation(raw.systemName(), data, location));
        } else {
            String type = action == null ? "null" : action.getClass().getSimpleName();
            throw new TransformException(TransformErrorKind.INVALID_ACTION,
                    "Unknown action type: " + type, location, serialize(action));
        }
    }

    private void checkOperation(RawOperation raw, Map<String, Object> data, SourceLocation location) {
        Optional<OperationSignature> signature = operations.find(raw.systemName());
        if (signature.isEmpty()) {
            List<String> suggestions = operations.suggest(raw.systemName(), MAX_SUGGESTIONS);
            throw new TransformException(TransformErrorKind.INVALID_ACTION,
                    String.format("Unknown operation '%s'", raw.systemName()), location, serialize(raw),
                    suggestions.isEmpty() ? null : "Did you mean: " + String.join(", ", suggestions) + "?");
        }
        List<String> missing = signature.get().missingKeys(data.keySet());
        if (!missing.isEmpty()) {
            throw new TransformException(TransformErrorKind.INVALID_ACTION,
                    String.format("Operation '%s' is missing required key(s): %s",
                            raw.systemName(), String.join(", ", missing)),
                    location, serialize(raw),
                    String.format("'%s' requires: %s", raw.systemName(),
                            String.join(", ", signature.get().requiredKeys())));
        }
    }

    private Map<String, Object> elementData(SelectorNode target, AnimationNode animation, Scope scope) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("selector", transformSelector(target, scope));
        if (animation != null) {
            data.put("animation", animation.name());
            if (!animation.arguments().isEmpty()) {
                data.put("animationArgs", transformValues(animation.arguments(), scope));
            }
        }
        return data;
    }

    private void expandCall(ActionCall call, List<Operation> start, List<Operation> end, Scope scope) {
        SourceLocation location = scope.locate(call);
        Map<String, Object> startData = new LinkedHashMap<>();

        ActionDeclaration callee = scope.declarations.get(call.actionName());
        if (callee != null) {
            Map<String, Object> bound = new LinkedHashMap<>();
            List<ParameterNode> parameters = callee.parameters();
            for (int i = 0; i < parameters.size(); i++) {
                ParameterNode parameter = parameters.get(i);
                if (i < call.arguments().size()) {
                    bound.put(parameter.name(), transformValue(call.arguments().get(i), scope));
                } else if (parameter.defaultValue() != null) {
                    bound.put(parameter.name(), transformValue(parameter.defaultValue(), scope));
                }
            }
            if (!bound.isEmpty()) {
                startData.put("actionOperationData", bound);
            }
        } else if (!call.arguments().isEmpty()) {
            startData.put("callArgs", transformValues(call.arguments(), scope));
        }

        start.add(scope.operation(REQUEST_ACTION, Map.of("systemName", call.actionName()), location));
        start.add(scope.operation(START_ACTION, startData, location));
        end.add(scope.operation(REQUEST_ACTION, Map.of("systemName", call.actionName()), location));
        end.add(scope.operation(END_ACTION, Map.of(), location));
    }

    // ========== Values ==========

    private TargetSelector transformSelector(SelectorNode selector, Scope scope) {
        SourceLocation location = scope.locate(selector);
        if (selector instanceof IdSelector id) {
            return new TargetSelector(SelectorKind.ID, id.value(), location);
        }
        if (selector instanceof ClassSelector className) {
            return new TargetSelector(SelectorKind.CLASS, className.value(), location);
        }
        if (selector instanceof ElementSelector element) {
            return new TargetSelector(SelectorKind.ELEMENT, element.value(), location);
        }
        if (selector instanceof QuerySelector query) {
            return new TargetSelector(SelectorKind.QUERY, query.value(), location);
        }
        String type = selector == null ? "null" : selector.getClass().getSimpleName();
        throw new TransformException(TransformErrorKind.INVALID_EXPRESSION, "Unknown selector type: " + type, location);
    }

    private List<Object> transformValues(List<ValueNode> values, Scope scope) {
        List<Object> result = new ArrayList<>(values.size());
        for (ValueNode value : values) {
            result.add(transformValue(value, scope));
        }
        return Collections.unmodifiableList(result);
    }

    private Object transformValue(ValueNode value, Scope scope) {
        if (value instanceof StringLiteral string) {
            return string.value();
        }
        if (value instanceof BooleanLiteral bool) {
            return bool.value();
        }
        if (value instanceof NullLiteral) {
            return null;
        }
        if (value instanceof ArrayLiteral array) {
            return transformValues(array.elements(), scope);
        }
        if (value instanceof NumberLiteral number) {
            return NumberUtils.normalize(number.value());
        }
        if (value instanceof SelectorNode selector) {
            return transformSelector(selector, scope);
        }
        if (value instanceof TimeExpressionNode expression) {
            return transformTime(expression, scope);
        }
        String type = value == null ? "null" : value.getClass().getSimpleName();
        throw new TransformException(TransformErrorKind.INVALID_EXPRESSION,
                "Unknown value type: " + type, scope.locate(value));
    }

    private TimeExpression transformTime(TimeExpressionNode expression, Scope scope) {
        if (expression instanceof NumberLiteral number) {
            return TimeExpression.literal(number.value());
        }
        if (expression instanceof VariableReference variable) {
            return TimeExpression.variable(variable.name());
        }
        if (expression instanceof BinaryExpression binary) {
            // an unsupported symbol is kept as a null operator and rejected by the type checker
            BinaryOperator operator = BinaryOperator.fromSymbol(binary.operator()).orElse(null);
            return TimeExpression.binary(operator,
                    transformTime(binary.left(), scope),
                    transformTime(binary.right(), scope));
        }
        String type = expression == null ? "null" : expression.getClass().getSimpleName();
        throw new TransformException(TransformErrorKind.INVALID_EXPRESSION,
                "Unknown time expression type: " + type, scope.locate(expression));
    }

    private static String serialize(Node node) {
        try {
            return NODE_WRITER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return String.valueOf(node);
        }
    }

    /**
     * State of a single transformation: the caller's context plus the program's action declarations.
     */
    private static final class Scope {
        private final CompilationContext context;
        private final String file;
        private final Map<String, ActionDeclaration> declarations = new HashMap<>();

        private Scope(CompilationContext context, Program program) {
            this.context = Objects.requireNonNull(context, "context");
            this.file = context.sourceFile().orElse(null);
            for (Element element : program.elements()) {
                if (element instanceof ActionDeclaration action) {
                    declarations.putIfAbsent(action.name(), action);
                }
            }
        }

        private SourceLocation locate(Node node) {
            SourceLocation location = LocationUtils.locate(node, file);
            return location.file() == null && file != null ? location.withFile(file) : location;
        }

        private Operation operation(String systemName, Map<String, Object> data, SourceLocation location) {
            return new Operation(context.nextId(), systemName, data, location);
        }
    }
}
