package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.exception.*;
import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * Turns a {@link CompilationException} into a {@link FormattedError}.
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class ErrorReporter {

    static final int CONTEXT_LINES = 2;

    private ErrorReporter() {}

    public static FormattedError format(CompilationException error) {
        return format(error, null);
    }

    /**
     * @param error  the failure
     * @param source the compiled source text, used for the code snippet; may be {@code null}
     */
    public static FormattedError format(CompilationException error, String source) {
        SourceLocation location = error.getLocation();
        return new FormattedError(
                FormattedError.Severity.ERROR,
                header(error),
                location,
                hint(error),
                source == null ? null : snippet(source, location));
    }

    static String header(CompilationException error) {
        String title = error.getCategory().title();
        String qualifier;
        if (error instanceof ValidationException e) {
            qualifier = e.getKind().name();
        } else if (error instanceof TransformException e) {
            qualifier = e.getKind().name();
        } else if (error instanceof OptimizationException e) {
            qualifier = e.getPass();
        } else {
            qualifier = null;
        }
        String headline = qualifier == null
                ? title + ": " + error.getMessage()
                : title + " (" + qualifier + "): " + error.getMessage();
        return headline + "\n  at " + error.getLocation().format();
    }

    static String hint(CompilationException error) {
        if (error instanceof ParseException e) {
            return e.getExpected() != null ? "Expected " + e.getExpected() : "Check the syntax near this location";
        }
        if (error instanceof ValidationException e) {
            if (e.getHint() != null) {
                return e.getHint();
            }
            return switch (e.getKind()) {
                case TIMELINE_REQUIRED -> "Add a timeline declaration, e.g. 'timeline raf'";
                case DUPLICATE_DEFINITION -> "Rename or remove the duplicate declaration";
                case INVALID_PROVIDER -> "Use one of: raf, video, audio";
                case MISSING_SOURCE -> "Add a source with 'from \"file\"'";
                case ACTION_NOT_DEFINED -> "Declare the action before calling it";
                case PARAMETER_ARITY_MISMATCH -> "Check the number of arguments against the action parameters";
            };
        }
        if (error instanceof TransformException e) {
            if (e.getHint() != null) {
                return e.getHint();
            }
            return switch (e.getKind()) {
                case INVALID_TIMELINE -> "Declare exactly one timeline, e.g. 'timeline raf'";
                case INVALID_EVENT -> "Give the event a time range, e.g. 'event intro at 0..10 { ... }'";
                case INVALID_ACTION -> "Use show, hide, animate, trigger, call or op";
                case INVALID_EXPRESSION -> "Use a #id, .class, tag or \"query\" selector and + - * / in time expressions";
            };
        }
        if (error instanceof TypeCheckException e) {
            return e.getExpected() == null ? null : "Expected " + e.getExpected() + " but got " + e.getActual();
        }
        if (error instanceof OptimizationException) {
            return "Action time ranges must not reference unbound variables";
        }
        return null;
    }

    /**
     * Lines around {@code location}, numbered, with a caret line under the error.
     */
    static String snippet(String source, SourceLocation location) {
        String[] lines = source.split("\r?\n", -1);
        int errorLine = location.line();
        if (errorLine > lines.length) {
            return null;
        }
        int first = Math.max(1, errorLine - CONTEXT_LINES);
        int last = Math.min(lines.length, errorLine + CONTEXT_LINES);
        int width = String.valueOf(last).length();

        StringBuilder out = new StringBuilder();
        for (int n = first; n <= last; n++) {
            String text = lines[n - 1];
            out.append(String.format("%" + width + "d | %s", n, text)).append('\n');
            if (n == errorLine) {
                int column = Math.min(location.column(), text.length() + 1);
                int carets = Math.max(1, Math.min(location.length(), text.length() - column + 1));
                out.append(" ".repeat(width)).append(" | ")
                        .append(" ".repeat(column - 1))
                        .append("^".repeat(carets))
                        .append('\n');
            }
        }
        return out.toString().stripTrailing();
    }
}
