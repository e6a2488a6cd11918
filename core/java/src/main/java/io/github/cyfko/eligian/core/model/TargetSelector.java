package io.github.cyfko.eligian.core.model;

/**
 * Tagged reference to a DOM-like target.
 * <p>
 * Selectors are stored as structured values inside operation data and flattened to their
 * conventional string form ({@code #id}, {@code .class}, {@code tag} or the raw query) when the
 * engine configuration is produced.
 * </p>
 *
 * @param kind     how the target is addressed
 * @param value    identifier, class name, tag name or raw query
 * @param location source span of the selector
 */
public record TargetSelector(SelectorKind kind, String value, SourceLocation location) {

    public TargetSelector {
        location = location == null ? SourceLocation.unknown() : location;
    }

    public static TargetSelector id(String value) {
        return new TargetSelector(SelectorKind.ID, value, SourceLocation.unknown());
    }

    public static TargetSelector className(String value) {
        return new TargetSelector(SelectorKind.CLASS, value, SourceLocation.unknown());
    }

    public static TargetSelector element(String value) {
        return new TargetSelector(SelectorKind.ELEMENT, value, SourceLocation.unknown());
    }

    public static TargetSelector query(String value) {
        return new TargetSelector(SelectorKind.QUERY, value, SourceLocation.unknown());
    }

    /**
     * @return the selector in CSS notation
     */
    public String toSelectorString() {
        return switch (kind) {
            case ID -> "#" + value;
            case CLASS -> "." + value;
            case ELEMENT, QUERY -> value;
        };
    }
}
