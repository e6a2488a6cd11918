package io.github.cyfko.eligian.core.spi;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdGenerator Tests")
class IdGeneratorTest {

    @Test
    @DisplayName("Should produce a deterministic sequence")
    void sequential() {
        SequentialIdGenerator ids = new SequentialIdGenerator("node");

        assertEquals("node-1", ids.nextId());
        assertEquals("node-2", ids.nextId());
        assertEquals("id-1", new SequentialIdGenerator().nextId());
    }

    @Test
    @DisplayName("Should produce unique random identifiers")
    void uuid() {
        UuidIdGenerator ids = new UuidIdGenerator();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < 1000; i++) {
            assertTrue(seen.add(ids.nextId()));
        }
    }
}
