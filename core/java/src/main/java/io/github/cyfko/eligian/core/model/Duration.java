package io.github.cyfko.eligian.core.model;

/**
 * Time window of a timeline action. Both bounds become literals once folded.
 *
 * @param start opening time
 * @param end   closing time
 */
public record Duration(TimeExpression start, TimeExpression end) {

    public static Duration of(double start, double end) {
        return new Duration(TimeExpression.literal(start), TimeExpression.literal(end));
    }

    /**
     * @return {@code true} when both bounds are literal numbers
     */
    public boolean isConcrete() {
        return start instanceof TimeExpression.Literal && end instanceof TimeExpression.Literal;
    }
}
