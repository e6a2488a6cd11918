package io.github.cyfko.eligian.core.exception;

/**
 * Distinguishes failures of the lexer from failures of the grammar.
 */
public enum ParseErrorKind {
    LEXICAL,
    SYNTAX
}
