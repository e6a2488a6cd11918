package io.github.cyfko.eligian.core.parsing;

import io.github.cyfko.eligian.core.ast.EligianAst.*;
import io.github.cyfko.eligian.core.ast.SourceSpan;
import io.github.cyfko.eligian.core.exception.ParseErrorKind;
import io.github.cyfko.eligian.core.exception.ParseException;
import io.github.cyfko.eligian.core.model.ParameterType;
import io.github.cyfko.eligian.core.model.SourceLocation;
import io.github.cyfko.eligian.core.utils.LocationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds an Eligian syntax tree from a token stream.
 * <p>
 * Time expressions use the usual precedence: {@code *} and {@code /} bind tighter than
 * {@code +} and {@code -}, all left associative. A leading {@code -} is only accepted in front of
 * a number literal.
 * </p>
 * <p>
 * Parenthesized expressions, array literals and operator chains count towards a nesting limit
 * ({@link #DEFAULT_MAX_NESTING_DEPTH} unless configured) so that a hostile input fails with a
 * {@link ParseException} instead of exhausting the stack.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class RecursiveDescentParser {

    private static final Set<String> RESERVED = Set.of(
            "timeline", "event", "action", "at", "from", "end",
            "show", "hide", "animate", "trigger", "call", "op", "with", "on",
            "true", "false", "null");

    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    private final List<Token> tokens;
    private final String file;
    private final int maxNestingDepth;
    private int current;
    private int nesting;

    public RecursiveDescentParser(List<Token> tokens, String file) {
        this(tokens, file, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param tokens          token stream ending with {@link TokenType#EOF}
     * @param file            source file used in error locations, may be {@code null}
     * @param maxNestingDepth maximum nesting of parentheses, arrays and operators in one value
     */
    public RecursiveDescentParser(List<Token> tokens, String file, int maxNestingDepth) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        this.file = file;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * @return the program node spanning the whole input
     * @throws ParseException with {@link ParseErrorKind#SYNTAX} on the first grammar violation
     */
    public Program parseProgram() {
        List<Element> elements = new ArrayList<>();
        while (!peek().is(TokenType.EOF)) {
            elements.add(parseElement());
        }
        return new Program(elements, new SourceSpan(0, 0, 0, peek().endOffset()));
    }

    // ========== Declarations ==========

    private Element parseElement() {
        Token token = peek();
        if (token.isKeyword("timeline")) {
            return parseTimeline();
        }
        if (token.isKeyword("event")) {
            return parseEvent();
        }
        if (token.isKeyword("action")) {
            return parseActionDeclaration();
        }
        throw syntaxError("'timeline', 'event' or 'action'", token);
    }

    private TimelineDeclaration parseTimeline() {
        Token start = advance();
        Token provider = expectName("timeline provider");
        String source = null;
        if (peek().isKeyword("from")) {
            advance();
            source = expect(TokenType.STRING, "timeline source").text();
        }
        return new TimelineDeclaration(provider.text(), source, spanFrom(start));
    }

    private EventDeclaration parseEvent() {
        Token start = advance();
        Token name = expectName("event name");
        Token at = expectKeyword("at");
        TimeExpressionNode from = parseTimeExpression();
        expect(TokenType.RANGE, "'..'");
        TimeExpressionNode to = parseTimeExpression();
        TimeRange range = new TimeRange(from, to, spanFrom(at));
        List<ActionNode> actions = parseBlock();
        return new EventDeclaration(name.text(), range, actions, spanFrom(start));
    }

    private ActionDeclaration parseActionDeclaration() {
        Token start = advance();
        Token name = expectName("action name");
        expect(TokenType.LPAREN, "'('");
        List<ParameterNode> parameters = new ArrayList<>();
        if (!peek().is(TokenType.RPAREN)) {
            do {
                parameters.add(parseParameter());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RPAREN, "')'");
        List<ActionNode> startActions = parseBlock();
        List<ActionNode> endActions = List.of();
        if (peek().isKeyword("end")) {
            advance();
            endActions = parseBlock();
        }
        return new ActionDeclaration(name.text(), parameters, startActions, endActions, spanFrom(start));
    }

    private ParameterNode parseParameter() {
        Token name = expectName("parameter name");
        String type = null;
        if (match(TokenType.COLON)) {
            Token typeToken = peek();
            if (!typeToken.is(TokenType.IDENT) || ParameterType.fromName(typeToken.text()).isEmpty()) {
                throw syntaxError("parameter type (selector, number, string, boolean, any)", typeToken);
            }
            type = advance().text();
        }
        ValueNode defaultValue = null;
        if (match(TokenType.EQUALS)) {
            defaultValue = parseValue();
        }
        return new ParameterNode(name.text(), type, defaultValue, spanFrom(name));
    }

    private List<ActionNode> parseBlock() {
        expect(TokenType.LBRACE, "'{'");
        List<ActionNode> actions = new ArrayList<>();
        while (!peek().is(TokenType.RBRACE)) {
            if (peek().is(TokenType.EOF)) {
                throw syntaxError("'}'", peek());
            }
            actions.add(parseAction());
        }
        advance();
        return actions;
    }

    // ========== Actions ==========

    private ActionNode parseAction() {
        Token start = peek();
        if (!start.is(TokenType.IDENT)) {
            throw syntaxError("an action", start);
        }
        switch (start.text()) {
            case "show" -> {
                advance();
                SelectorNode target = parseSelector();
                return new ShowAction(target, parseOptionalAnimation(), spanFrom(start));
            }
            case "hide" -> {
                advance();
                SelectorNode target = parseSelector();
                return new HideAction(target, parseOptionalAnimation(), spanFrom(start));
            }
            case "animate" -> {
                advance();
                SelectorNode target = parseSelector();
                if (!peek().isKeyword("with")) {
                    throw syntaxError("'with'", peek());
                }
                return new AnimateAction(target, parseOptionalAnimation(), spanFrom(start));
            }
            case "trigger" -> {
                advance();
                Token name = expectName("action name");
                SelectorNode target = null;
                if (peek().isKeyword("on")) {
                    advance();
                    target = parseSelector();
                }
                return new TriggerAction(name.text(), target, spanFrom(start));
            }
            case "call" -> {
                advance();
                Token name = expectName("action name");
                return new ActionCall(name.text(), parseArguments(), spanFrom(start));
            }
            case "op" -> {
                advance();
                Token systemName = expectName("operation name");
                return new RawOperation(systemName.text(), parseProperties(), spanFrom(start));
            }
            default -> throw syntaxError("an action (show, hide, animate, trigger, call, op)", start);
        }
    }

    private AnimationNode parseOptionalAnimation() {
        if (!peek().isKeyword("with")) {
            return null;
        }
        Token start = advance();
        Token name = expectName("animation name");
        List<ValueNode> arguments = peek().is(TokenType.LPAREN) ? parseArguments() : List.of();
        return new AnimationNode(name.text(), arguments, spanFrom(start));
    }

    private List<ValueNode> parseArguments() {
        expect(TokenType.LPAREN, "'('");
        List<ValueNode> arguments = new ArrayList<>();
        if (!peek().is(TokenType.RPAREN)) {
            do {
                arguments.add(parseValue());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RPAREN, "')'");
        return arguments;
    }

    private List<PropertyNode> parseProperties() {
        List<PropertyNode> properties = new ArrayList<>();
        if (!match(TokenType.LBRACE)) {
            return properties;
        }
        if (!peek().is(TokenType.RBRACE)) {
            do {
                Token key = peek();
                if (!key.is(TokenType.IDENT) && !key.is(TokenType.STRING)) {
                    throw syntaxError("property name", key);
                }
                advance();
                expect(TokenType.COLON, "':'");
                ValueNode value = parseValue();
                properties.add(new PropertyNode(key.text(), value, spanFrom(key)));
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RBRACE, "'}'");
        return properties;
    }

    private SelectorNode parseSelector() {
        Token token = peek();
        return switch (token.type()) {
            case ID_NAME -> new IdSelector(advance().text(), token.span());
            case CLASS_NAME -> new ClassSelector(advance().text(), token.span());
            case STRING -> new QuerySelector(advance().text(), token.span());
            case IDENT -> {
                if (RESERVED.contains(token.text())) {
                    throw syntaxError("a selector", token);
                }
                yield new ElementSelector(advance().text(), token.span());
            }
            default -> throw syntaxError("a selector", token);
        };
    }

    // ========== Values ==========

    private ValueNode parseValue() {
        Token token = peek();
        switch (token.type()) {
            case STRING -> {
                advance();
                return new StringLiteral(token.text(), token.span());
            }
            case ID_NAME, CLASS_NAME -> {
                return parseSelector();
            }
            case LBRACKET -> {
                enter(advance());
                List<ValueNode> elements = new ArrayList<>();
                if (!peek().is(TokenType.RBRACKET)) {
                    do {
                        elements.add(parseValue());
                    } while (match(TokenType.COMMA));
                }
                expect(TokenType.RBRACKET, "']'");
                nesting--;
                return new ArrayLiteral(elements, spanFrom(token));
            }
            case IDENT -> {
                if (token.isKeyword("true") || token.isKeyword("false")) {
                    advance();
                    return new BooleanLiteral(Boolean.parseBoolean(token.text()), token.span());
                }
                if (token.isKeyword("null")) {
                    advance();
                    return new NullLiteral(token.span());
                }
                return parseTimeExpression();
            }
            default -> {
                return parseTimeExpression();
            }
        }
    }

    private TimeExpressionNode parseTimeExpression() {
        Token start = peek();
        TimeExpressionNode left = parseTerm();
        int operators = 0;
        while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
            Token operator = advance();
            enter(operator);
            operators++;
            TimeExpressionNode right = parseTerm();
            left = new BinaryExpression(operator.text(), left, right, spanFrom(start));
        }
        nesting -= operators;
        return left;
    }

    private TimeExpressionNode parseTerm() {
        Token start = peek();
        TimeExpressionNode left = parseFactor();
        int operators = 0;
        while (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH)) {
            Token operator = advance();
            enter(operator);
            operators++;
            TimeExpressionNode right = parseFactor();
            left = new BinaryExpression(operator.text(), left, right, spanFrom(start));
        }
        nesting -= operators;
        return left;
    }

    private TimeExpressionNode parseFactor() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new NumberLiteral(Double.parseDouble(token.text()), token.span());
            }
            case MINUS -> {
                advance();
                Token number = expect(TokenType.NUMBER, "number");
                return new NumberLiteral(-Double.parseDouble(number.text()), spanFrom(token));
            }
            case LPAREN -> {
                enter(advance());
                TimeExpressionNode inner = parseTimeExpression();
                expect(TokenType.RPAREN, "')'");
                nesting--;
                return inner;
            }
            case IDENT -> {
                if (RESERVED.contains(token.text())) {
                    throw syntaxError("a time expression", token);
                }
                advance();
                return new VariableReference(token.text(), token.span());
            }
            default -> throw syntaxError("a time expression", token);
        }
    }

    // ========== Token helpers ==========

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String expected) {
        if (!peek().is(type)) {
            throw syntaxError(expected, peek());
        }
        return advance();
    }

    private Token expectKeyword(String keyword) {
        if (!peek().isKeyword(keyword)) {
            throw syntaxError("'" + keyword + "'", peek());
        }
        return advance();
    }

    private Token expectName(String expected) {
        Token token = peek();
        if (!token.is(TokenType.IDENT) || RESERVED.contains(token.text())) {
            throw syntaxError(expected, token);
        }
        return advance();
    }

    private void enter(Token token) {
        if (++nesting > maxNestingDepth) {
            throw new ParseException(ParseErrorKind.SYNTAX,
                    String.format("Expression nested too deeply (max: %d levels)", maxNestingDepth),
                    LocationUtils.locate(token.span(), file));
        }
    }

    private SourceSpan spanFrom(Token start) {
        return start.span().to(previous().span());
    }

    private ParseException syntaxError(String expected, Token actual) {
        SourceLocation location = LocationUtils.locate(actual.span(), file);
        return new ParseException(ParseErrorKind.SYNTAX,
                String.format("Expected %s but found %s", expected, actual.describe()),
                location, expected, actual.describe());
    }
}
