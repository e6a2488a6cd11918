package io.github.cyfko.eligian.core.config;

import io.github.cyfko.eligian.core.model.LanguageLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Configuration Tests")
class CompileOptionsTest {

    @Test
    @DisplayName("Should optimize and pretty print by default")
    void defaults() {
        CompileOptions options = CompileOptions.defaults();

        assertTrue(options.optimize());
        assertFalse(options.minify());
        assertFalse(options.partialFolding());
        assertEquals(options, CompileOptions.builder().build());
        assertFalse(CompileOptions.unoptimized().optimize());
    }

    @Test
    @DisplayName("Should build custom options")
    void builder() {
        CompileOptions options = CompileOptions.builder().optimize(false).minify(true).partialFolding(true).build();

        assertEquals(new CompileOptions(false, true, true), options);
    }

    @Test
    @DisplayName("Should provide the engine defaults")
    void engineDefaults() {
        ConfigurationDefaults defaults = ConfigurationDefaults.eligius();

        assertEquals("Eligius", defaults.engine().systemName());
        assertEquals("body", defaults.containerSelector());
        assertEquals("en", defaults.language());
        assertEquals("default", defaults.layoutTemplate());
        assertEquals(List.of(new LanguageLabel("en", "English")), defaults.availableLanguages());
    }

    @Test
    @DisplayName("Should validate custom defaults")
    void validatesDefaults() {
        assertThrows(IllegalArgumentException.class,
                () -> new ConfigurationDefaults(" ", "body", "en", "default", List.of(), null));

        ConfigurationDefaults custom = new ConfigurationDefaults("Eligius", "#stage", "fr", "", null, null);
        assertEquals("#stage", custom.timelineSelector());
        assertTrue(custom.availableLanguages().isEmpty());
    }
}
