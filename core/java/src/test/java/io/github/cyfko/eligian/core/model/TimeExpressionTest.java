package io.github.cyfko.eligian.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeExpression Tests")
class TimeExpressionTest {

    @Test
    @DisplayName("Should render unresolved expressions")
    void render() {
        TimeExpression expression = TimeExpression.binary(BinaryOperator.MULTIPLY,
                TimeExpression.binary(BinaryOperator.PLUS, TimeExpression.variable("start"), TimeExpression.literal(1.5)),
                TimeExpression.literal(2));

        assertEquals("(($start + 1.5) * 2)", expression.render());
    }

    @ParameterizedTest
    @CsvSource({"+, PLUS", "-, MINUS", "*, MULTIPLY", "/, DIVIDE"})
    @DisplayName("Should resolve operators from their symbol")
    void fromSymbol(String symbol, BinaryOperator expected) {
        assertEquals(expected, BinaryOperator.fromSymbol(symbol).orElseThrow());
        assertEquals(symbol, expected.symbol());
    }

    @Test
    @DisplayName("Should reject unknown operator symbols")
    void unknownSymbol() {
        assertTrue(BinaryOperator.fromSymbol("%").isEmpty());
        assertTrue(BinaryOperator.fromSymbol(null).isEmpty());
    }

    @Test
    @DisplayName("Should divide by zero to zero")
    void divisionByZero() {
        assertEquals(0d, BinaryOperator.DIVIDE.apply(10, 0));
        assertEquals(2.5d, BinaryOperator.DIVIDE.apply(10, 4));
    }

    @Test
    @DisplayName("Should report its variant kind")
    void kinds() {
        assertEquals(TimeExpression.Kind.LITERAL, TimeExpression.literal(1).kind());
        assertEquals(TimeExpression.Kind.VARIABLE, TimeExpression.variable("x").kind());
        assertEquals(TimeExpression.Kind.BINARY,
                TimeExpression.binary(BinaryOperator.PLUS, TimeExpression.literal(1), TimeExpression.literal(2)).kind());
    }
}
