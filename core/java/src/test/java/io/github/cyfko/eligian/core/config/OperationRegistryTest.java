package io.github.cyfko.eligian.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OperationRegistry Tests")
class OperationRegistryTest {

    private final OperationRegistry registry = OperationRegistry.eligius();

    @Test
    @DisplayName("Should know the operations the transformer emits")
    void knowsBuiltIns() {
        for (String name : List.of("showElement", "hideElement", "animateElement", "triggerAction",
                "requestAction", "startAction", "endAction")) {
            assertTrue(registry.find(name).isPresent(), name);
        }
        assertTrue(registry.find("setVisibility").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    @DisplayName("Should report missing required keys in declaration order")
    void missingKeys() {
        OperationSignature signature = OperationSignature.of("custom", "first", "second");

        assertEquals(List.of("first", "second"), signature.missingKeys(Set.of()));
        assertEquals(List.of("second"), signature.missingKeys(Set.of("first", "other")));
        assertTrue(registry.find("addClass").orElseThrow().missingKeys(Set.of("className")).isEmpty());
    }

    // ========== Suggestions ==========

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "adClass,     addClass",
            "wiat,        wait",
            "SHOWELEMENT, showElement",
            "hideElemnt,  hideElement"
    })
    @DisplayName("Should suggest the closest operation first")
    void suggestsClosest(String unknown, String expected) {
        List<String> suggestions = registry.suggest(unknown, 3);

        assertEquals(3, suggestions.size());
        assertEquals(expected, suggestions.get(0));
    }

    @Test
    @DisplayName("Should compute the edit distance")
    void editDistance() {
        assertEquals(0, OperationRegistry.editDistance("wait", "wait"));
        assertEquals(1, OperationRegistry.editDistance("adclass", "addclass"));
        assertEquals(3, OperationRegistry.editDistance("kitten", "sitting"));
        assertEquals(4, OperationRegistry.editDistance("", "wait"));
    }

    // ========== Construction ==========

    @Test
    @DisplayName("Should extend a preset with custom operations")
    void builderExtends() {
        OperationRegistry custom = OperationRegistry.builder()
                .from(registry)
                .operation("playSound", "src")
                .build();

        assertEquals(List.of("src"), custom.find("playSound").orElseThrow().requiredKeys());
        assertEquals(registry.operations().size() + 1, custom.operations().size());
        assertTrue(registry.find("playSound").isEmpty());
    }

    @Test
    @DisplayName("Should reject a key that does not match its signature")
    void rejectsMismatchedKey() {
        assertThrows(IllegalArgumentException.class,
                () -> new OperationRegistry(Map.of("wait", OperationSignature.of("delay"))));
        assertThrows(IllegalArgumentException.class, () -> new OperationRegistry(null));
        assertThrows(IllegalArgumentException.class, () -> OperationSignature.of(" "));
    }
}
