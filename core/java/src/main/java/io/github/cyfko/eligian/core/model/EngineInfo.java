package io.github.cyfko.eligian.core.model;

/**
 * Identifies the runtime engine a configuration targets.
 *
 * @param systemName engine name, {@code Eligius}
 */
public record EngineInfo(String systemName) {
}
