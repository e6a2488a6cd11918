package io.github.cyfko.eligian.core.exception;

/**
 * Coarse classification of compilation failures, one per pipeline stage.
 * <p>
 * The category is what a command line front end needs to pick a process exit code and a
 * diagnostic header without inspecting the concrete exception type.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public enum ErrorCategory {
    PARSE("Parse Error", 2),
    VALIDATION("Validation Error", 3),
    TRANSFORM("Transform Error", 4),
    TYPE("Type Error", 5),
    OPTIMIZATION("Optimization Error", 6),
    EMIT("Emit Error", 7);

    private final String title;
    private final int exitCode;

    ErrorCategory(String title, int exitCode) {
        this.title = title;
        this.exitCode = exitCode;
    }

    /**
     * @return human readable header used when formatting diagnostics
     */
    public String title() {
        return title;
    }

    /**
     * @return process exit code conventionally associated with this category
     */
    public int exitCode() {
        return exitCode;
    }
}
