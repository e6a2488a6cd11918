package io.github.cyfko.eligian.core.exception;

import io.github.cyfko.eligian.core.model.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CompilationException Tests")
class CompilationExceptionTest {

    @Test
    @DisplayName("Should classify every exception by stage")
    void categories() {
        SourceLocation at = SourceLocation.of(2, 4, 1);

        assertEquals(ErrorCategory.PARSE, new ParseException(ParseErrorKind.LEXICAL, "x", at).getCategory());
        assertEquals(ErrorCategory.VALIDATION,
                new ValidationException(ValidationErrorKind.MISSING_SOURCE, "x", at).getCategory());
        assertEquals(ErrorCategory.TRANSFORM,
                new TransformException(TransformErrorKind.INVALID_EVENT, "x", at).getCategory());
        assertEquals(ErrorCategory.TYPE, new TypeCheckException("x", at, "number", "string").getCategory());
        assertEquals(ErrorCategory.OPTIMIZATION, new OptimizationException("x", "fold", at).getCategory());
        assertEquals(ErrorCategory.EMIT, new EmitException("x").getCategory());
    }

    @Test
    @DisplayName("Should always carry a location")
    void locationNeverNull() {
        // Given
        TransformException transform = new TransformException(TransformErrorKind.INVALID_ACTION, "x", null);

        // Then
        assertEquals(SourceLocation.unknown(), transform.getLocation());
        assertEquals(SourceLocation.unknown(), new EmitException("x").getLocation());
    }

    @Test
    @DisplayName("Should map categories to distinct non-zero exit codes")
    void exitCodes() {
        List<Integer> codes = Arrays.stream(ErrorCategory.values()).map(ErrorCategory::exitCode).toList();

        assertEquals(codes.size(), codes.stream().distinct().count());
        assertFalse(codes.contains(0));
        assertEquals(2, ErrorCategory.PARSE.exitCode());
    }

    @Test
    @DisplayName("Should keep the wrapped cause")
    void cause() {
        IllegalStateException cause = new IllegalStateException("boom");

        assertSame(cause, new EmitException("failed", cause).getCause());
        assertSame(cause, new OptimizationException("failed", "fold", null, cause).getCause());
    }
}
