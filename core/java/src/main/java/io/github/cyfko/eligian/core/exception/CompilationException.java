package io.github.cyfko.eligian.core.exception;

import io.github.cyfko.eligian.core.model.SourceLocation;

import java.util.Objects;

/**
 * Base type of every failure raised by the Eligian compilation pipeline.
 * <p>
 * Each pipeline stage reports exactly one error, the first one it meets, through a subclass of
 * this exception. The pipeline never aggregates errors: the first failure aborts all remaining
 * stages and reaches the caller unchanged.
 * </p>
 *
 * <p><strong>Error Structure:</strong></p>
 * <ul>
 *   <li><strong>Category:</strong> the failing stage, see {@link ErrorCategory}</li>
 *   <li><strong>Message:</strong> a human readable description</li>
 *   <li><strong>Location:</strong> the source span the error points at, never {@code null}</li>
 * </ul>
 *
 * <p><strong>Handling Example:</strong></p>
 * <pre>{@code
 * try {
 *     String json = compiler.compileToJSON(source);
 * } catch (CompilationException e) {
 *     FormattedError report = ErrorReporter.format(e, source);
 *     System.err.println(report.message());
 *     System.exit(e.getCategory().exitCode());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 * @see ErrorCategory
 * @see io.github.cyfko.eligian.core.compiler.ErrorReporter
 */
public abstract class CompilationException extends RuntimeException {

    private final ErrorCategory category;
    private final SourceLocation location;

    /**
     * Creates an exception for the given category and location.
     *
     * @param category the failing stage
     * @param message  the description of the failure
     * @param location the offending source span, {@code null} falls back to {@link SourceLocation#unknown()}
     */
    protected CompilationException(ErrorCategory category, String message, SourceLocation location) {
        super(message);
        this.category = Objects.requireNonNull(category, "category");
        this.location = location == null ? SourceLocation.unknown() : location;
    }

    /**
     * Creates an exception wrapping an underlying cause.
     *
     * @param category the failing stage
     * @param message  the description of the failure
     * @param location the offending source span, {@code null} falls back to {@link SourceLocation#unknown()}
     * @param cause    the original cause
     */
    protected CompilationException(ErrorCategory category, String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category");
        this.location = location == null ? SourceLocation.unknown() : location;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
