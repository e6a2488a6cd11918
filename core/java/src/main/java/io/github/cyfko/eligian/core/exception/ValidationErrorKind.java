package io.github.cyfko.eligian.core.exception;

/**
 * Semantic rules checked on a grammatically valid program before transformation.
 */
public enum ValidationErrorKind {
    TIMELINE_REQUIRED,
    DUPLICATE_DEFINITION,
    INVALID_PROVIDER,
    MISSING_SOURCE,
    ACTION_NOT_DEFINED,
    PARAMETER_ARITY_MISMATCH
}
