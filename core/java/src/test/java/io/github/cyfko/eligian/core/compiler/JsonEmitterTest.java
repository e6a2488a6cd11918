package io.github.cyfko.eligian.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.eligian.core.model.CompilationMetadata;
import io.github.cyfko.eligian.core.model.IrDocument;
import io.github.cyfko.eligian.core.model.engine.EngineConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.github.cyfko.eligian.core.compiler.IrFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonEmitter Tests")
class JsonEmitterTest {

    private final JsonEmitter emitter = new JsonEmitter();
    private final ObjectMapper mapper = new ObjectMapper();

    private EngineConfiguration configuration() {
        IrDocument document = document(action("intro", 0, 10)).withMetadata(
                new CompilationMetadata("1.0.0", "0.0.1", Instant.parse("2026-01-02T03:04:05Z"), null));
        return new ConfigurationResolver().resolve(document);
    }

    @Test
    @DisplayName("Should pretty print by default and minify on request")
    void prettyAndMinified() throws Exception {
        String pretty = emitter.emit(configuration(), false);
        String minified = emitter.emit(configuration(), true);

        assertTrue(pretty.contains("\n"));
        assertFalse(minified.contains("\n"));
        assertEquals(mapper.readTree(pretty), mapper.readTree(minified));
    }

    @Test
    @DisplayName("Should write the engine document shape")
    void documentShape() throws Exception {
        JsonNode json = mapper.readTree(emitter.emit(configuration(), true));

        assertEquals("doc-1", json.get("id").asText());
        assertEquals("Eligius", json.get("engine").get("systemName").asText());
        assertEquals("body", json.get("containerSelector").asText());
        assertEquals("en", json.get("availableLanguages").get(0).get("code").asText());
        assertTrue(json.get("labels").isArray());
        assertTrue(json.get("initActions").isArray());
        assertTrue(json.get("actions").isArray());
        assertTrue(json.get("eventActions").isArray());
        assertFalse(json.has("timelineFlow"));
        assertFalse(json.has("timelineProviderSettings"));

        JsonNode timeline = json.get("timelines").get(0);
        assertEquals("raf", timeline.get("type").asText());
        assertFalse(timeline.has("uri"));
        assertEquals(10, timeline.get("timelineActions").get(0).get("duration").get("end").asInt());
    }

    @Test
    @DisplayName("Should write compiledAt as an ISO-8601 string and omit a missing source file")
    void metadata() throws Exception {
        JsonNode metadata = mapper.readTree(emitter.emit(configuration(), true)).get("metadata");

        assertEquals("2026-01-02T03:04:05Z", metadata.get("compiledAt").asText());
        assertEquals("1.0.0", metadata.get("dslVersion").asText());
        assertFalse(metadata.has("sourceFile"));
    }
}
