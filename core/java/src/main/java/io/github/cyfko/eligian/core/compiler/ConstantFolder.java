package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.model.TimeExpression;
import io.github.cyfko.eligian.core.model.TimeExpression.Binary;
import io.github.cyfko.eligian.core.model.TimeExpression.Literal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates literal-only time expression sub-trees.
 * <p>
 * In conservative mode a tree that contains any variable is returned as is, even when one of its
 * branches is literal only. In partial mode such branches are folded in place, so
 * {@code x + (2 * 3)} becomes {@code x + 6}. Division by zero folds to {@code 0}.
 * </p>
 * <p>
 * An instance counts the sub-trees it replaced and is meant for a single optimization run.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class ConstantFolder {

    private final boolean partial;
    private int folded;

    public ConstantFolder(boolean partial) {
        this.partial = partial;
    }

    /**
     * Conservative folding of a single expression.
     */
    public static TimeExpression foldConservatively(TimeExpression expression) {
        return new ConstantFolder(false).fold(expression);
    }

    public TimeExpression fold(TimeExpression expression) {
        if (!(expression instanceof Binary binary) || binary.operator() == null) {
            return expression;
        }
        if (partial) {
            TimeExpression left = fold(binary.left());
            TimeExpression right = fold(binary.right());
            if (left instanceof Literal l && right instanceof Literal r) {
                folded++;
                return TimeExpression.literal(binary.operator().apply(l.value(), r.value()));
            }
            if (left == binary.left() && right == binary.right()) {
                return binary;
            }
            return TimeExpression.binary(binary.operator(), left, right);
        }
        if (!isLiteralOnly(binary)) {
            return binary;
        }
        folded++;
        return TimeExpression.literal(evaluate(binary));
    }

    /**
     * Folds time expressions nested anywhere in an operation data value.
     *
     * @return a new container for lists and maps, the folded expression, or {@code value} itself
     */
    public Object foldValue(Object value) {
        if (value instanceof TimeExpression expression) {
            return fold(expression);
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object element : list) {
                result.add(foldValue(element));
            }
            return Collections.unmodifiableList(result);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                result.put(entry.getKey(), foldValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(result);
        }
        return value;
    }

    /**
     * @return number of sub-trees replaced by a literal so far
     */
    public int foldedCount() {
        return folded;
    }

    private static boolean isLiteralOnly(TimeExpression expression) {
        return switch (expression.kind()) {
            case LITERAL -> true;
            case VARIABLE -> false;
            case BINARY -> {
                Binary binary = (Binary) expression;
                yield binary.operator() != null && isLiteralOnly(binary.left()) && isLiteralOnly(binary.right());
            }
        };
    }

    private static double evaluate(TimeExpression expression) {
        if (expression instanceof Literal literal) {
            return literal.value();
        }
        Binary binary = (Binary) expression;
        return binary.operator().apply(evaluate(binary.left()), evaluate(binary.right()));
    }
}
