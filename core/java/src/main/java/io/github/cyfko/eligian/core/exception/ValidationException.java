package io.github.cyfko.eligian.core.exception;

import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * Exception thrown when a grammatically valid program breaks a semantic rule.
 * <p>
 * Typical causes are an unknown timeline provider, a duplicated event name or a call to an
 * action that the program never defines. Validation happens before the syntax tree is
 * transformed into the intermediate representation.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 * @see ValidationErrorKind
 */
public class ValidationException extends CompilationException {

    private final ValidationErrorKind kind;
    private final String hint;

    public ValidationException(ValidationErrorKind kind, String message, SourceLocation location) {
        this(kind, message, location, null);
    }

    /**
     * @param kind     the violated rule
     * @param message  the description of the failure
     * @param location the offending source span
     * @param hint     optional suggestion shown to the user, may be {@code null}
     */
    public ValidationException(ValidationErrorKind kind, String message, SourceLocation location, String hint) {
        super(ErrorCategory.VALIDATION, message, location);
        this.kind = kind;
        this.hint = hint;
    }

    public ValidationErrorKind getKind() {
        return kind;
    }

    public String getHint() {
        return hint;
    }
}
