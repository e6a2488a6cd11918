package io.github.cyfko.eligian.core.config;

import io.github.cyfko.eligian.core.model.EngineInfo;
import io.github.cyfko.eligian.core.model.LanguageLabel;

import java.util.List;

/**
 * Structural defaults written into every document, for settings the DSL does not express yet.
 *
 * @param engineSystemName   engine targeted by the configuration
 * @param containerSelector  selector of the presentation root
 * @param language           default language code
 * @param layoutTemplate     layout template name
 * @param availableLanguages languages offered to the viewer
 * @param timelineSelector   container selector of each timeline
 * @author Frank KOSSI
 * @since 0.0.1
 */
public record ConfigurationDefaults(
        String engineSystemName,
        String containerSelector,
        String language,
        String layoutTemplate,
        List<LanguageLabel> availableLanguages,
        String timelineSelector) {

    public ConfigurationDefaults {
        if (engineSystemName == null || engineSystemName.isBlank()) {
            throw new IllegalArgumentException("engineSystemName is required");
        }
        if (containerSelector == null || containerSelector.isBlank()) {
            throw new IllegalArgumentException("containerSelector is required");
        }
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language is required");
        }
        if (layoutTemplate == null) {
            throw new IllegalArgumentException("layoutTemplate is required");
        }
        availableLanguages = availableLanguages == null ? List.of() : List.copyOf(availableLanguages);
        timelineSelector = timelineSelector == null ? containerSelector : timelineSelector;
    }

    /**
     * @return the Eligius defaults: {@code body} container, English only, default layout
     */
    public static ConfigurationDefaults eligius() {
        return new ConfigurationDefaults(
                "Eligius",
                "body",
                "en",
                "default",
                List.of(new LanguageLabel("en", "English")),
                "body");
    }

    public EngineInfo engine() {
        return new EngineInfo(engineSystemName);
    }
}
