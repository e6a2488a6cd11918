package io.github.cyfko.eligian.core.model;

/**
 * A language offered by the presentation.
 *
 * @param code  language code, e.g. {@code en}
 * @param label display name, e.g. {@code English}
 */
public record LanguageLabel(String code, String label) {
}
