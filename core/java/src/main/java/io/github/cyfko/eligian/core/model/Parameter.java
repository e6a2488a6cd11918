package io.github.cyfko.eligian.core.model;

/**
 * Typed parameter of an action definition.
 *
 * @param name         parameter name
 * @param type         declared type
 * @param defaultValue flattened default value, {@code null} when the parameter is required
 * @param location     source span of the parameter
 */
public record Parameter(String name, ParameterType type, Object defaultValue, SourceLocation location) {

    public Parameter {
        type = type == null ? ParameterType.ANY : type;
        location = location == null ? SourceLocation.unknown() : location;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
