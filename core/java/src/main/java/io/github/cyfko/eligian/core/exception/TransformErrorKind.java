package io.github.cyfko.eligian.core.exception;

/**
 * Reasons why a syntax tree cannot be turned into the intermediate representation.
 */
public enum TransformErrorKind {
    /** Missing or duplicated timeline declaration, or an unknown provider. */
    INVALID_TIMELINE,
    /** Event without a time range. */
    INVALID_EVENT,
    /** Action node whose variant is not recognized. */
    INVALID_ACTION,
    /** Time expression, operator or selector whose variant is not recognized. */
    INVALID_EXPRESSION
}
