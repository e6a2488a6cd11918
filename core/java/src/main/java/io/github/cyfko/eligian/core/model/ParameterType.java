package io.github.cyfko.eligian.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Declared type of an action definition parameter. {@link #ANY} is used when no type is written.
 */
public enum ParameterType {
    SELECTOR,
    NUMBER,
    STRING,
    BOOLEAN,
    ANY;

    public static Optional<ParameterType> fromName(String name) {
        if (name == null) {
            return Optional.of(ANY);
        }
        try {
            return Optional.of(valueOf(name.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
