package io.github.cyfko.eligian.core.exception;

import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * Exception thrown when source text cannot be tokenized or does not match the Eligian grammar.
 * <p>
 * Parse errors are raised before any syntax tree exists, so they are the only errors whose
 * location is computed directly from character offsets of the source text.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("timeline raf \u0000");
 * // → LEXICAL: "Unexpected character '\u0000'"
 *
 * parser.parse("timeline raf\nevent intro 0..5 { show #title }");
 * // → SYNTAX: "Expected 'at' but found '0'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 * @see ParseErrorKind
 */
public class ParseException extends CompilationException {

    private final ParseErrorKind kind;
    private final String expected;
    private final String actual;

    /**
     * Constructor for failures without an expected/actual token pair.
     *
     * @param kind     lexical or syntactic failure
     * @param message  the description of the failure
     * @param location the offending source span
     */
    public ParseException(ParseErrorKind kind, String message, SourceLocation location) {
        this(kind, message, location, null, null);
    }

    /**
     * Constructor for grammar failures that know which token was expected.
     *
     * @param kind     lexical or syntactic failure
     * @param message  the description of the failure
     * @param location the offending source span
     * @param expected what the grammar expected, may be {@code null}
     * @param actual   what was found instead, may be {@code null}
     */
    public ParseException(ParseErrorKind kind, String message, SourceLocation location, String expected, String actual) {
        super(ErrorCategory.PARSE, message, location);
        this.kind = kind;
        this.expected = expected;
        this.actual = actual;
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
