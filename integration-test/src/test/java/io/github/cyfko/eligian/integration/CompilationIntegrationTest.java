package io.github.cyfko.eligian.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.eligian.core.EligianCompiler;
import io.github.cyfko.eligian.core.compiler.ErrorReporter;
import io.github.cyfko.eligian.core.compiler.FormattedError;
import io.github.cyfko.eligian.core.config.CompileOptions;
import io.github.cyfko.eligian.core.exception.*;
import io.github.cyfko.eligian.core.model.IrDocument;
import io.github.cyfko.eligian.core.model.TimeExpression;
import io.github.cyfko.eligian.core.model.TimelineAction;
import io.github.cyfko.eligian.core.spi.SequentialIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compiles complete {@code .eligian} programs from source text to the engine JSON document.
 */
@DisplayName("Compilation Integration Tests")
class CompilationIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private EligianCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = EligianCompiler.builder().idGenerators(SequentialIdGenerator::new).build();
    }

    private static List<String> names(JsonNode array, String field) {
        List<String> names = new ArrayList<>();
        array.forEach(node -> names.add(node.get(field).asText()));
        return names;
    }

    // ========== Presentation ==========

    @Test
    @DisplayName("Should compile a presentation to the engine document")
    void compilesPresentation() throws Exception {
        // Given
        String source = FixtureLoader.load("presentation.eligian");

        // When
        JsonNode json = mapper.readTree(compiler.compileToJSON(source, CompileOptions.defaults(), "presentation.eligian"));

        // Then
        assertEquals("Eligius", json.get("engine").get("systemName").asText());
        assertEquals("presentation.eligian", json.get("metadata").get("sourceFile").asText());

        JsonNode timeline = json.get("timelines").get(0);
        assertEquals("video", timeline.get("type").asText());
        assertEquals("media/presentation.mp4", timeline.get("uri").asText());
        assertEquals(30, timeline.get("duration").asInt());
        assertEquals(List.of("intro", "details", "outro"), names(timeline.get("timelineActions"), "name"));

        JsonNode details = timeline.get("timelineActions").get(1);
        assertEquals(10, details.get("duration").get("start").asInt());
        assertEquals(20, details.get("duration").get("end").asInt());
    }

    @Test
    @DisplayName("Should expand action calls and map built-in actions")
    void expandsActions() throws Exception {
        JsonNode json = mapper.readTree(compiler.compileToJSON(FixtureLoader.load("presentation.eligian")));
        JsonNode actions = json.get("timelines").get(0).get("timelineActions");

        JsonNode intro = actions.get(0);
        assertEquals(List.of("showElement", "requestAction", "startAction"),
                names(intro.get("startOperations"), "systemName"));
        assertEquals(List.of("requestAction", "endAction"), names(intro.get("endOperations"), "systemName"));
        JsonNode bound = intro.get("startOperations").get(2).get("operationData").get("actionOperationData");
        assertEquals("#subtitle", bound.get("target").asText());
        assertEquals(500, bound.get("speed").asInt());

        JsonNode animate = actions.get(1).get("startOperations").get(0).get("operationData");
        assertEquals(".content > p", animate.get("selector").asText());
        assertEquals("slideIn", animate.get("animation").asText());
        assertEquals(300, animate.get("animationArgs").get(0).asInt());

        JsonNode trigger = actions.get(1).get("startOperations").get(1).get("operationData");
        assertEquals("highlight", trigger.get("actionName").asText());
        assertEquals(".keyword", trigger.get("selector").asText());

        JsonNode raw = actions.get(2).get("startOperations").get(0).get("operationData");
        assertEquals("#footer", raw.get("selector").asText());
        assertEquals("visible", raw.get("className").asText());
        assertEquals(25, raw.get("delay").asInt());

        JsonNode fadeIn = json.get("actions").get(0);
        assertEquals("fadeIn", fadeIn.get("name").asText());
        assertEquals("showElement", fadeIn.get("startOperations").get(0).get("systemName").asText());
        assertEquals("hideElement", fadeIn.get("endOperations").get(0).get("systemName").asText());
    }

    @Test
    @DisplayName("Should keep the folded-away event when optimization is disabled")
    void unoptimized() throws Exception {
        String source = FixtureLoader.load("presentation.eligian");

        JsonNode json = mapper.readTree(compiler.compileToJSON(source, CompileOptions.unoptimized()));

        assertEquals(List.of("intro", "details", "skipped", "outro"),
                names(json.get("timelines").get(0).get("timelineActions"), "name"));
    }

    // ========== Variables ==========

    @Test
    @DisplayName("Should keep variable time ranges in the IR and refuse to resolve them")
    void variables() {
        String source = FixtureLoader.load("variables.eligian");

        IrDocument document = compiler.compileToIR(source);
        TimelineAction synced = document.timelines().get(0).actions().get(1);
        assertEquals(TimeExpression.variable("offset"), synced.duration().start());
        assertEquals(TimeExpression.Kind.BINARY, synced.duration().end().kind());

        OptimizationException e = assertThrows(OptimizationException.class, () -> compiler.compileToJSON(source));
        assertEquals("resolve-times", e.getPass());
    }

    @Test
    @DisplayName("Should fold literal branches below variables with partial folding")
    void partialFolding() {
        String source = FixtureLoader.load("variables.eligian");

        IrDocument document = compiler.compileToIR(source, CompileOptions.builder().partialFolding(true).build());

        assertEquals("($offset + 6)", document.timelines().get(0).actions().get(1).duration().end().render());
    }

    // ========== Diagnostics ==========

    @Test
    @DisplayName("Should report an unknown provider with its location")
    void invalidProvider() {
        String source = FixtureLoader.load("invalid-provider.eligian");

        ValidationException e = assertThrows(ValidationException.class,
                () -> compiler.compileToJSON(source, CompileOptions.defaults(), "invalid-provider.eligian"));

        assertEquals(ValidationErrorKind.INVALID_PROVIDER, e.getKind());
        assertEquals("invalid-provider.eligian", e.getLocation().file());
        assertEquals(1, e.getLocation().line());
        assertEquals(3, e.getCategory().exitCode());
    }

    @Test
    @DisplayName("Should render a syntax error with a code snippet")
    void syntaxError() {
        String source = FixtureLoader.load("syntax-error.eligian");

        ParseException e = assertThrows(ParseException.class,
                () -> compiler.compileToJSON(source, CompileOptions.defaults(), "syntax-error.eligian"));
        FormattedError formatted = ErrorReporter.format(e, source);

        assertEquals(ParseErrorKind.SYNTAX, e.getKind());
        assertEquals(5, e.getLocation().line());
        assertEquals(3, e.getLocation().column());
        assertTrue(formatted.message().startsWith("Parse Error: "));
        assertTrue(formatted.message().endsWith("\n  at syntax-error.eligian:5:3"));
        assertTrue(formatted.codeSnippet().contains("5 |   wobble #title"));
        assertTrue(formatted.codeSnippet().contains("^^^^^^"));
    }
}
