package io.github.cyfko.eligian.core.parsing;

import io.github.cyfko.eligian.core.ast.SourceSpan;

/**
 * A lexical token.
 *
 * @param type        category
 * @param text        token value; for strings the unescaped content, for names without the sigil
 * @param line        0-based line
 * @param column      0-based column
 * @param startOffset offset of the first character
 * @param endOffset   offset just past the last character
 */
public record Token(TokenType type, String text, int line, int column, int startOffset, int endOffset) {

    public SourceSpan span() {
        return new SourceSpan(line, column, startOffset, endOffset);
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENT && text.equals(keyword);
    }

    /**
     * @return description used in syntax error messages
     */
    public String describe() {
        return switch (type) {
            case EOF -> type.description();
            case STRING -> "\"" + text + "\"";
            case ID_NAME -> "'#" + text + "'";
            case CLASS_NAME -> "'." + text + "'";
            default -> "'" + text + "'";
        };
    }
}
