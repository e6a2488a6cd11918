package io.github.cyfko.eligian.core.exception;

import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * Exception thrown when an IR node is structurally present but violates a value constraint.
 * <p>
 * Examples are a time literal that is not a finite number, a selector without a kind, or a
 * negative animation duration. The type checker is fail-fast: it throws this exception for the
 * first violation in traversal order.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * // operationData: { duration: -100 }
 * // → "Operation 'animateElement': duration must be non-negative" (expected ">= 0", actual "-100")
 *
 * // operationData: { duration: "fast" }
 * // → "Operation 'animateElement': duration must be a number" (expected "number", actual "string")
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class TypeCheckException extends CompilationException {

    private final String expected;
    private final String actual;

    /**
     * @param message  the description of the failure
     * @param location the offending source span
     * @param expected the expected type or value range
     * @param actual   the type or value found
     */
    public TypeCheckException(String message, SourceLocation location, String expected, String actual) {
        super(ErrorCategory.TYPE, message, location);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
