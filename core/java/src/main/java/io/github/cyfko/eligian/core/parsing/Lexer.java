package io.github.cyfko.eligian.core.parsing;

import io.github.cyfko.eligian.core.exception.ParseErrorKind;
import io.github.cyfko.eligian.core.exception.ParseException;
import io.github.cyfko.eligian.core.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single pass tokenizer for Eligian source text.
 * <p>
 * Whitespace and {@code //} line comments are skipped. Identifiers follow
 * {@code [A-Za-z_][A-Za-z0-9_]*}; names after {@code #} and {@code .} may also contain
 * {@code -} so that CSS identifiers such as {@code #sub-title} read naturally. The token stream
 * always ends with an {@link TokenType#EOF} token.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class Lexer {

    private final String source;
    private final String file;
    private final List<Token> tokens = new ArrayList<>();

    private int pos;
    private int line;
    private int column;

    public Lexer(String source, String file) {
        this.source = Objects.requireNonNull(source, "source");
        this.file = file;
    }

    /**
     * Tokenizes the whole source.
     *
     * @return the tokens, terminated by {@link TokenType#EOF}
     * @throws ParseException with {@link ParseErrorKind#LEXICAL} on an unexpected character or an unterminated string
     */
    public List<Token> tokenize() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                advance();
                continue;
            }
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }
            if (c == '/' && peek(1) == '/') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    advance();
                }
                continue;
            }

            int startLine = line;
            int startColumn = column;
            int start = pos;

            if (isIdentifierStart(c)) {
                while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                    advance();
                }
                add(TokenType.IDENT, source.substring(start, pos), startLine, startColumn, start);
            } else if (Character.isDigit(c)) {
                readNumber(startLine, startColumn, start);
            } else if (c == '"' || c == '\'') {
                readString(c, startLine, startColumn, start);
            } else if (c == '#') {
                advance();
                add(TokenType.ID_NAME, readName('#', startLine, startColumn), startLine, startColumn, start);
            } else if (c == '.') {
                if (peek(1) == '.') {
                    advance();
                    advance();
                    add(TokenType.RANGE, "..", startLine, startColumn, start);
                } else {
                    advance();
                    add(TokenType.CLASS_NAME, readName('.', startLine, startColumn), startLine, startColumn, start);
                }
            } else {
                TokenType type = switch (c) {
                    case '{' -> TokenType.LBRACE;
                    case '}' -> TokenType.RBRACE;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    case '[' -> TokenType.LBRACKET;
                    case ']' -> TokenType.RBRACKET;
                    case ',' -> TokenType.COMMA;
                    case ':' -> TokenType.COLON;
                    case '=' -> TokenType.EQUALS;
                    case '+' -> TokenType.PLUS;
                    case '-' -> TokenType.MINUS;
                    case '*' -> TokenType.STAR;
                    case '/' -> TokenType.SLASH;
                    default -> throw new ParseException(ParseErrorKind.LEXICAL,
                            String.format("Unexpected character '%s'", printable(c)),
                            location(startLine, startColumn, 1));
                };
                advance();
                add(type, String.valueOf(c), startLine, startColumn, start);
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, column, pos, pos));
        return List.copyOf(tokens);
    }

    private void readNumber(int startLine, int startColumn, int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            advance();
        }
        // a single dot followed by a digit is a decimal point, '..' is a range
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            advance();
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                advance();
            }
        }
        add(TokenType.NUMBER, source.substring(start, pos), startLine, startColumn, start);
    }

    private void readString(char quote, int startLine, int startColumn, int start) {
        advance();
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= source.length() || source.charAt(pos) == '\n') {
                throw new ParseException(ParseErrorKind.LEXICAL, "Unterminated string literal",
                        location(startLine, startColumn, pos - start));
            }
            char c = source.charAt(pos);
            if (c == quote) {
                advance();
                break;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                advance();
                char escaped = source.charAt(pos);
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> escaped;
                });
                advance();
                continue;
            }
            value.append(c);
            advance();
        }
        add(TokenType.STRING, value.toString(), startLine, startColumn, start);
    }

    private String readName(char sigil, int startLine, int startColumn) {
        int nameStart = pos;
        if (pos >= source.length() || !isIdentifierStart(source.charAt(pos))) {
            throw new ParseException(ParseErrorKind.LEXICAL,
                    String.format("Expected a name after '%s'", sigil),
                    location(startLine, startColumn, 1));
        }
        while (pos < source.length() && (isIdentifierPart(source.charAt(pos)) || source.charAt(pos) == '-')) {
            advance();
        }
        return source.substring(nameStart, pos);
    }

    private void add(TokenType type, String text, int startLine, int startColumn, int start) {
        tokens.add(new Token(type, text, startLine, startColumn, start, pos));
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 0;
        } else {
            column++;
        }
        pos++;
    }

    private char peek(int ahead) {
        int index = pos + ahead;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private SourceLocation location(int line, int column, int length) {
        return new SourceLocation(file, line + 1, column + 1, length);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private static String printable(char c) {
        return Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
    }
}
