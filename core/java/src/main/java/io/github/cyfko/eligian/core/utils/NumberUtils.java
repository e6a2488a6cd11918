package io.github.cyfko.eligian.core.utils;

/**
 * Numeric helpers for JSON output.
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class NumberUtils {

    private static final double MAX_EXACT_LONG = 9_007_199_254_740_992d; // 2^53

    private NumberUtils() {}

    /**
     * Returns the most natural JSON number for a double: integral values within the exactly
     * representable range become {@link Long} so that {@code 10.0} is written as {@code 10}.
     *
     * @param value the value to normalize
     * @return a {@link Long} for integral values, the {@link Double} otherwise
     */
    public static Number normalize(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) <= MAX_EXACT_LONG) {
            if (value == 0d) {
                return 0L; // folds -0.0
            }
            return (long) value;
        }
        return value;
    }

    /**
     * Formats a number without a trailing {@code .0} for integral values.
     *
     * @param value the value to format
     * @return textual form, e.g. {@code "8"} or {@code "2.5"}
     */
    public static String format(double value) {
        return String.valueOf(normalize(value));
    }
}
