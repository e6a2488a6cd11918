package io.github.cyfko.eligian.core.model;

import io.github.cyfko.eligian.core.utils.NumberUtils;

/**
 * A point in time on a timeline, possibly unresolved until optimization.
 * <p>
 * The hierarchy is closed: consumers switch over {@link #kind()} with an exhaustive switch
 * expression, so a new variant does not compile until every consumer handles it.
 * </p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link Literal}: a number of seconds</li>
 *   <li>{@link Variable}: a named value resolved at run time, never evaluated by the compiler</li>
 *   <li>{@link Binary}: {@code left op right} with one of the {@link BinaryOperator}s</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public sealed interface TimeExpression permits TimeExpression.Literal, TimeExpression.Variable, TimeExpression.Binary {

    /**
     * Discriminant of the variants.
     */
    enum Kind { LITERAL, VARIABLE, BINARY }

    Kind kind();

    /**
     * Renders the expression the way the runtime engine reads unresolved values:
     * literals as numbers, variables as {@code $name}, binaries as {@code (left op right)}.
     *
     * @return the display form of this expression
     */
    String render();

    static Literal literal(double value) {
        return new Literal(value);
    }

    static Variable variable(String name) {
        return new Variable(name);
    }

    static Binary binary(BinaryOperator operator, TimeExpression left, TimeExpression right) {
        return new Binary(operator, left, right);
    }

    record Literal(double value) implements TimeExpression {
        @Override
        public Kind kind() {
            return Kind.LITERAL;
        }

        @Override
        public String render() {
            return NumberUtils.format(value);
        }
    }

    record Variable(String name) implements TimeExpression {
        @Override
        public Kind kind() {
            return Kind.VARIABLE;
        }

        @Override
        public String render() {
            return "$" + name;
        }
    }

    record Binary(BinaryOperator operator, TimeExpression left, TimeExpression right) implements TimeExpression {
        @Override
        public Kind kind() {
            return Kind.BINARY;
        }

        @Override
        public String render() {
            String symbol = operator == null ? "?" : operator.symbol();
            return "(" + left.render() + " " + symbol + " " + right.render() + ")";
        }
    }
}
