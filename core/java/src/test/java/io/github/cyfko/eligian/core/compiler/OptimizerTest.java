package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static io.github.cyfko.eligian.core.compiler.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Optimizer Tests")
class OptimizerTest {

    private final Optimizer optimizer = new Optimizer();

    // ========== Dead-code elimination ==========

    @Nested
    @DisplayName("Dead-code elimination")
    class DeadCodeElimination {

        @Test
        @DisplayName("Should drop zero-length actions and keep declaration order")
        void dropsZeroDuration() {
            // Given
            IrDocument document = document(
                    action("valid", 0, 10),
                    action("zero", 5, 5),
                    action("alsoValid", 10, 20));

            // When
            IrDocument optimized = optimizer.optimize(document);

            // Then
            assertEquals(List.of("valid", "alsoValid"), names(optimized));
        }

        @Test
        @DisplayName("Should drop negative start and negative duration")
        void dropsNegativeStartAndDuration() {
            IrDocument document = document(
                    action("first", 0, 5),
                    action("negativeStart", -5, 10),
                    action("negativeDuration", 20, 10),
                    action("last", 5, 8));

            IrDocument optimized = optimizer.optimize(document);

            assertEquals(List.of("first", "last"), names(optimized));
        }

        @Test
        @DisplayName("Should keep actions with unresolved bounds")
        void keepsVariableBounds() {
            IrDocument document = document(
                    action("variableStart", var("t"), lit(10)),
                    action("variableEnd", lit(10), var("t")));

            assertEquals(List.of("variableStart", "variableEnd"), names(optimizer.optimize(document)));
            assertEquals(List.of("variableStart", "variableEnd"),
                    names(new Optimizer(true).optimize(document)));
        }

        @ParameterizedTest(name = "[{0}, {1}] dead = {2}")
        @CsvSource({
                "0, 10, false",
                "5, 5, true",
                "20, 10, true",
                "-1, 3, true",
                "0, 0.5, false"
        })
        @DisplayName("Should classify literal durations")
        void classifiesDurations(double start, double end, boolean dead) {
            assertEquals(dead, Optimizer.isDead(Duration.of(start, end)));
        }

        @Test
        @DisplayName("Should recompute timeline duration from retained actions")
        void recomputesDuration() {
            IrDocument document = document(action("kept", 0, 10), action("dead", 40, 30));
            assertEquals(30d, document.timelines().get(0).duration());

            IrDocument optimized = optimizer.optimize(document);

            assertEquals(10d, optimized.timelines().get(0).duration());
        }
    }

    // ========== Constant folding ==========

    @Nested
    @DisplayName("Constant folding")
    class Folding {

        @Test
        @DisplayName("Should fold durations before eliminating dead actions")
        void foldsBeforeElimination() {
            // Given: 2*3 and 12/2 are different trees but both evaluate to 6
            IrDocument document = document(
                    action("kept", bin(BinaryOperator.PLUS, lit(1), lit(1)), bin(BinaryOperator.MULTIPLY, lit(2), lit(5))),
                    action("collapsed", bin(BinaryOperator.MULTIPLY, lit(2), lit(3)), bin(BinaryOperator.DIVIDE, lit(12), lit(2))));

            // When
            IrDocument optimized = optimizer.optimize(document);

            // Then
            assertEquals(List.of("kept"), names(optimized));
            TimelineAction kept = optimized.timelines().get(0).actions().get(0);
            assertEquals(Duration.of(2, 10), kept.duration());
        }

        @Test
        @DisplayName("Should fold time expressions in operation data")
        void foldsOperationData() {
            Operation operation = operation("wait", Map.of(
                    "delay", bin(BinaryOperator.PLUS, lit(1), lit(2)),
                    "steps", List.of(bin(BinaryOperator.MINUS, lit(9), lit(4)), "label")));
            IrDocument document = document(action("intro", lit(0), lit(10), operation));

            IrDocument optimized = optimizer.optimize(document);

            Map<String, Object> data = optimized.timelines().get(0).actions().get(0)
                    .startOperations().get(0).operationData();
            assertEquals(lit(3), data.get("delay"));
            assertEquals(List.of(lit(5), "label"), data.get("steps"));
        }

        @Test
        @DisplayName("Should fold operation data of action definitions")
        void foldsDefinitions() {
            ActionDefinition definition = new ActionDefinition("def-1", "fadeIn", List.of(),
                    List.of(operation("wait", Map.of("delay", bin(BinaryOperator.MULTIPLY, lit(2), lit(2))))),
                    List.of(), SourceLocation.unknown());
            IrDocument document = document(action("intro", 0, 10)).withActions(List.of(definition));

            IrDocument optimized = optimizer.optimize(document);

            assertEquals(lit(4), optimized.actions().get(0).startOperations().get(0).operationData().get("delay"));
        }

        @Test
        @DisplayName("Should keep partially foldable trees by default")
        void conservativeByDefault() {
            TimeExpression end = bin(BinaryOperator.PLUS, var("x"), bin(BinaryOperator.MULTIPLY, lit(2), lit(3)));
            IrDocument document = document(action("intro", lit(0), end));

            IrDocument optimized = optimizer.optimize(document);

            assertEquals(end, optimized.timelines().get(0).actions().get(0).duration().end());
        }

        @Test
        @DisplayName("Should fold literal branches below a variable when partial folding is enabled")
        void partialFolding() {
            TimeExpression end = bin(BinaryOperator.PLUS, var("x"), bin(BinaryOperator.MULTIPLY, lit(2), lit(3)));
            IrDocument document = document(action("intro", lit(0), end));

            IrDocument optimized = new Optimizer(true).optimize(document);

            assertEquals(bin(BinaryOperator.PLUS, var("x"), lit(6)),
                    optimized.timelines().get(0).actions().get(0).duration().end());
        }
    }

    // ========== Immutability ==========

    @Test
    @DisplayName("Should never return the input document or share its containers")
    void externalImmutability() {
        // Given: nothing to fold or remove
        IrDocument document = document(action("intro", 0, 10));

        // When
        IrDocument optimized = optimizer.optimize(document);

        // Then
        assertNotSame(document, optimized);
        assertNotSame(document.timelines(), optimized.timelines());
        assertNotSame(document.timelines().get(0), optimized.timelines().get(0));
        assertNotSame(document.timelines().get(0).actions(), optimized.timelines().get(0).actions());
        assertNotSame(document.actions(), optimized.actions());
        assertEquals(document.timelines().get(0).actions(), optimized.timelines().get(0).actions());
    }

    @Test
    @DisplayName("Should leave the input document untouched")
    void inputUnchanged() {
        IrDocument document = document(action("valid", 0, 10), action("dead", 5, 5));

        optimizer.optimize(document);

        assertEquals(List.of("valid", "dead"), names(document));
    }
}
