package io.github.cyfko.eligian.core.exception;

import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * Exception thrown when a rewrite or resolution pass cannot produce a required value.
 * <p>
 * The optimizer itself never fails on type-checked input. This channel is used when the
 * pipeline requires a concrete number, for instance an action time that still references an
 * unresolved variable when the engine configuration is produced.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class OptimizationException extends CompilationException {

    private final String pass;

    public OptimizationException(String message, String pass, SourceLocation location) {
        super(ErrorCategory.OPTIMIZATION, message, location);
        this.pass = pass;
    }

    public OptimizationException(String message, String pass, SourceLocation location, Throwable cause) {
        super(ErrorCategory.OPTIMIZATION, message, location, cause);
        this.pass = pass;
    }

    /**
     * @return name of the pass that failed
     */
    public String getPass() {
        return pass;
    }
}
