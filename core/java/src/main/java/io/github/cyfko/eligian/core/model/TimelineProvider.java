package io.github.cyfko.eligian.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Time sources a timeline can be driven by.
 */
public enum TimelineProvider {
    /** {@code requestAnimationFrame}, no media source. */
    RAF("raf", false),
    VIDEO("video", true),
    AUDIO("audio", true);

    private final String systemName;
    private final boolean sourceRequired;

    TimelineProvider(String systemName, boolean sourceRequired) {
        this.systemName = systemName;
        this.sourceRequired = sourceRequired;
    }

    /**
     * @return the name used in source text and in the engine configuration
     */
    public String systemName() {
        return systemName;
    }

    /**
     * @return {@code true} when the provider plays a media file and needs a source URI
     */
    public boolean isSourceRequired() {
        return sourceRequired;
    }

    public static Optional<TimelineProvider> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (TimelineProvider provider : values()) {
            if (provider.systemName.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
