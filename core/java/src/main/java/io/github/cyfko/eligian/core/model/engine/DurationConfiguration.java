package io.github.cyfko.eligian.core.model.engine;

/**
 * Numeric time window.
 *
 * @param start opening time
 * @param end   closing time
 */
public record DurationConfiguration(Number start, Number end) {
}
