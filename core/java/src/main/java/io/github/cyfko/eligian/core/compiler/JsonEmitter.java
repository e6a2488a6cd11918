package io.github.cyfko.eligian.core.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.cyfko.eligian.core.exception.EmitException;
import io.github.cyfko.eligian.core.model.engine.EngineConfiguration;

/**
 * Serializes an {@link EngineConfiguration} to JSON, pretty printed or on a single line.
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class JsonEmitter {

    private final ObjectWriter pretty;
    private final ObjectWriter compact;

    public JsonEmitter() {
        this(new ObjectMapper());
    }

    /**
     * @param mapper base mapper; it is copied, not modified
     */
    public JsonEmitter(ObjectMapper mapper) {
        ObjectMapper configured = mapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.pretty = configured.writer().with(SerializationFeature.INDENT_OUTPUT);
        this.compact = configured.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param configuration resolved configuration
     * @param minify        single line output when {@code true}
     * @throws EmitException when serialization fails
     */
    public String emit(EngineConfiguration configuration, boolean minify) {
        try {
            return (minify ? compact : pretty).writeValueAsString(configuration);
        } catch (JsonProcessingException e) {
            throw new EmitException("Failed to serialize configuration: " + e.getOriginalMessage(), e);
        }
    }
}
