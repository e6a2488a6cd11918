package io.github.cyfko.eligian.core.utils;

import java.util.*;

/**
 * Copy helpers used by the immutable IR records.
 * <p>
 * Every call returns a <strong>new</strong> unmodifiable container, even when the input is
 * already unmodifiable. The optimizer relies on this: a rewritten document never shares a list
 * or map instance with the document it was derived from.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class CollectionUtils {

    private CollectionUtils() {}

    /**
     * Copies the given list into a new unmodifiable list, preserving order.
     * {@code null} elements are kept.
     *
     * @param source list to copy, {@code null} yields an empty list
     * @param <T> element type
     * @return a fresh unmodifiable list
     */
    public static <T> List<T> immutableList(Collection<? extends T> source) {
        if (source == null) {
            return Collections.unmodifiableList(new ArrayList<>());
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    /**
     * Copies the given map into a new unmodifiable map, preserving insertion order.
     * {@code null} values are kept.
     *
     * @param source map to copy, {@code null} yields an empty map
     * @param <V> value type
     * @return a fresh unmodifiable map
     */
    public static <V> Map<String, V> immutableMap(Map<String, ? extends V> source) {
        if (source == null) {
            return Collections.unmodifiableMap(new LinkedHashMap<>());
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
