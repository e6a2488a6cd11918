package io.github.cyfko.eligian.core.exception;

import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * Exception thrown when the final configuration cannot be serialized.
 * <p>
 * A type-checked document always serializes; this exception wraps serializer failures so that
 * they reach the caller as a typed compilation error rather than as a library exception.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class EmitException extends CompilationException {

    public EmitException(String message) {
        super(ErrorCategory.EMIT, message, SourceLocation.unknown());
    }

    public EmitException(String message, Throwable cause) {
        super(ErrorCategory.EMIT, message, SourceLocation.unknown(), cause);
    }
}
