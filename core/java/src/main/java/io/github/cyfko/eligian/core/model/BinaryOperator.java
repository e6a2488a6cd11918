package io.github.cyfko.eligian.core.model;

import java.util.Optional;

/**
 * The four arithmetic operators allowed in time expressions.
 * <p>
 * Division by zero evaluates to {@code 0} instead of failing; downstream configurations rely on
 * this value.
 * </p>
 */
public enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Applies this operator.
     *
     * @param left  left operand
     * @param right right operand
     * @return the result, {@code 0} for a division by zero
     */
    public double apply(double left, double right) {
        return switch (this) {
            case PLUS -> left + right;
            case MINUS -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> right == 0d ? 0d : left / right;
        };
    }

    /**
     * Resolves an operator from its source symbol.
     *
     * @param symbol one of {@code + - * /}
     * @return the operator, empty when the symbol is not an allowed operator
     */
    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        for (BinaryOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
