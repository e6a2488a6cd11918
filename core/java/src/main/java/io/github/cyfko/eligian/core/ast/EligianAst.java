package io.github.cyfko.eligian.core.ast;

import java.util.List;

/**
 * Syntax tree of an Eligian program, as produced by a {@link io.github.cyfko.eligian.core.api.SourceParser}.
 * <p>
 * The node interfaces are deliberately open: a syntax tree may come from any parser, so the
 * transformer must reject node types it does not know instead of assuming a closed set.
 * Every node exposes its {@link SourceSpan}, which is {@code null} for synthesized nodes.
 * </p>
 *
 * <pre>
 * program    := element*
 * element    := timeline | event | actionDef
 * timeline   := 'timeline' IDENT ('from' STRING)?
 * event      := 'event' IDENT 'at' timeExpr '..' timeExpr block
 * actionDef  := 'action' IDENT '(' params? ')' block ('end' block)?
 * </pre>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class EligianAst {
    private EligianAst() {}

    /** Any syntax node. */
    public interface Node {
        SourceSpan span();
    }

    /** Top level declaration. */
    public interface Element extends Node {}

    /** Statement inside an event or action block. */
    public interface ActionNode extends Node {}

    /** Argument or property value. */
    public interface ValueNode extends Node {}

    /** Target of a built-in action. */
    public interface SelectorNode extends ValueNode {}

    /** Arithmetic over times. */
    public interface TimeExpressionNode extends ValueNode {}

    public record Program(List<Element> elements, SourceSpan span) implements Node {
        public Program {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }

    // ========== Declarations ==========

    public record TimelineDeclaration(String provider, String source, SourceSpan span) implements Element {}

    public record EventDeclaration(String name, TimeRange timeRange, List<ActionNode> actions, SourceSpan span)
            implements Element {
        public EventDeclaration {
            actions = actions == null ? List.of() : List.copyOf(actions);
        }
    }

    public record TimeRange(TimeExpressionNode start, TimeExpressionNode end, SourceSpan span) implements Node {}

    public record ActionDeclaration(
            String name,
            List<ParameterNode> parameters,
            List<ActionNode> startActions,
            List<ActionNode> endActions,
            SourceSpan span) implements Element {
        public ActionDeclaration {
            parameters = parameters == null ? List.of() : List.copyOf(parameters);
            startActions = startActions == null ? List.of() : List.copyOf(startActions);
            endActions = endActions == null ? List.of() : List.copyOf(endActions);
        }
    }

    /**
     * @param type         declared type name, {@code null} when untyped
     * @param defaultValue default value, {@code null} when required
     */
    public record ParameterNode(String name, String type, ValueNode defaultValue, SourceSpan span) implements Node {}

    // ========== Actions ==========

    public record ShowAction(SelectorNode target, AnimationNode animation, SourceSpan span) implements ActionNode {}

    public record HideAction(SelectorNode target, AnimationNode animation, SourceSpan span) implements ActionNode {}

    public record AnimateAction(SelectorNode target, AnimationNode animation, SourceSpan span) implements ActionNode {}

    /** {@code trigger name (on selector)?}; {@code target} may be {@code null}. */
    public record TriggerAction(String actionName, SelectorNode target, SourceSpan span) implements ActionNode {}

    public record ActionCall(String actionName, List<ValueNode> arguments, SourceSpan span) implements ActionNode {
        public ActionCall {
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }
    }

    /** Escape hatch: {@code op systemName { key: value, ... }}. */
    public record RawOperation(String systemName, List<PropertyNode> properties, SourceSpan span) implements ActionNode {
        public RawOperation {
            properties = properties == null ? List.of() : List.copyOf(properties);
        }
    }

    /** {@code with name(args)}. */
    public record AnimationNode(String name, List<ValueNode> arguments, SourceSpan span) implements Node {
        public AnimationNode {
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }
    }

    public record PropertyNode(String key, ValueNode value, SourceSpan span) implements Node {}

    // ========== Selectors ==========

    public record IdSelector(String value, SourceSpan span) implements SelectorNode {}

    public record ClassSelector(String value, SourceSpan span) implements SelectorNode {}

    public record ElementSelector(String value, SourceSpan span) implements SelectorNode {}

    public record QuerySelector(String value, SourceSpan span) implements SelectorNode {}

    // ========== Values ==========

    public record StringLiteral(String value, SourceSpan span) implements ValueNode {}

    public record BooleanLiteral(boolean value, SourceSpan span) implements ValueNode {}

    public record NullLiteral(SourceSpan span) implements ValueNode {}

    public record ArrayLiteral(List<ValueNode> elements, SourceSpan span) implements ValueNode {
        public ArrayLiteral {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }

    // ========== Time expressions ==========

    public record NumberLiteral(double value, SourceSpan span) implements TimeExpressionNode {}

    public record VariableReference(String name, SourceSpan span) implements TimeExpressionNode {}

    /** {@code operator} is the raw source symbol; the transformer rejects anything but {@code + - * /}. */
    public record BinaryExpression(String operator, TimeExpressionNode left, TimeExpressionNode right, SourceSpan span)
            implements TimeExpressionNode {}
}
