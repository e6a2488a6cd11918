package io.github.cyfko.eligian.core.compiler;

import io.github.cyfko.eligian.core.exception.OptimizationException;
import io.github.cyfko.eligian.core.model.*;
import io.github.cyfko.eligian.core.model.engine.EngineConfiguration;
import io.github.cyfko.eligian.core.model.engine.TimelineActionConfiguration;
import io.github.cyfko.eligian.core.model.engine.TimelineConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.github.cyfko.eligian.core.compiler.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigurationResolver Tests")
class ConfigurationResolverTest {

    private final ConfigurationResolver resolver = new ConfigurationResolver();

    @Test
    @DisplayName("Should resolve durations to numbers and fill empty engine lists")
    void resolvesDocument() {
        // Given
        IrDocument document = document(action("intro", lit(0), bin(BinaryOperator.PLUS, lit(4), lit(6))));

        // When
        EngineConfiguration configuration = resolver.resolve(document);

        // Then
        assertEquals("doc-1", configuration.id());
        assertTrue(configuration.labels().isEmpty());
        assertTrue(configuration.initActions().isEmpty());
        assertTrue(configuration.eventActions().isEmpty());
        assertNull(configuration.timelineFlow());
        assertNull(configuration.timelineProviderSettings());

        TimelineConfiguration timeline = configuration.timelines().get(0);
        assertEquals("raf", timeline.type());
        assertEquals(10L, timeline.duration());
        TimelineActionConfiguration intro = timeline.timelineActions().get(0);
        assertEquals(0L, intro.duration().start());
        assertEquals(10L, intro.duration().end());
    }

    @Test
    @DisplayName("Should flatten selectors and render unresolved expressions")
    void flattensOperationData() {
        Operation operation = operation("custom", Map.of(
                "selector", TargetSelector.className("item"),
                "delay", bin(BinaryOperator.PLUS, var("offset"), lit(2)),
                "ratio", lit(0.5),
                "targets", List.of(TargetSelector.id("a"), TargetSelector.query("main p"))));

        EngineConfiguration configuration = resolver.resolve(document(action("intro", lit(0), lit(1), operation)));

        Map<String, Object> data = configuration.timelines().get(0).timelineActions().get(0)
                .startOperations().get(0).operationData();
        assertEquals(".item", data.get("selector"));
        assertEquals("($offset + 2)", data.get("delay"));
        assertEquals(0.5, data.get("ratio"));
        assertEquals(List.of("#a", "main p"), data.get("targets"));
    }

    @Test
    @DisplayName("Should fail when an action bound references a variable")
    void failsOnVariableBound() {
        IrDocument document = document(action("intro", var("t"), lit(10)));

        OptimizationException e = assertThrows(OptimizationException.class, () -> resolver.resolve(document));

        assertEquals(ConfigurationResolver.PASS_NAME, e.getPass());
        assertTrue(e.getMessage().contains("$t"));
    }

    @Test
    @DisplayName("Should resolve action definitions")
    void resolvesDefinitions() {
        ActionDefinition definition = new ActionDefinition("def-1", "fade", List.of(),
                List.of(operation("showElement", Map.of("selector", TargetSelector.id("x")))),
                List.of(), SourceLocation.unknown());
        IrDocument document = document(action("intro", 0, 1)).withActions(List.of(definition));

        EngineConfiguration configuration = resolver.resolve(document);

        assertEquals("fade", configuration.actions().get(0).name());
        assertEquals("#x", configuration.actions().get(0).startOperations().get(0).operationData().get("selector"));
    }
}
