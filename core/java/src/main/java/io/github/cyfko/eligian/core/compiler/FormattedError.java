package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * A compilation error ready for display.
 *
 * @param severity    severity of the diagnostic
 * @param message     header line followed by the location line, e.g.
 *                    {@code Transform Error (INVALID_EVENT): ...\n  at intro.eligian:3:1}
 * @param location    offending location
 * @param hint        suggestion for fixing the error, may be {@code null}
 * @param codeSnippet source excerpt with a caret marker, {@code null} when no source text is available
 * @author Frank KOSSI
 * @since 0.0.1
 */
public record FormattedError(Severity severity, String message, SourceLocation location, String hint, String codeSnippet) {

    public enum Severity { ERROR, WARNING }

    /**
     * @return multi-line text: header with location, snippet and hint
     */
    public String render() {
        StringBuilder out = new StringBuilder(message);
        if (codeSnippet != null) {
            out.append("\n\n").append(codeSnippet);
        }
        if (hint != null) {
            out.append("\n\nHint: ").append(hint);
        }
        return out.toString();
    }
}
