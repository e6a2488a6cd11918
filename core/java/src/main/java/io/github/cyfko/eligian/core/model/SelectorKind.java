package io.github.cyfko.eligian.core.model;

/**
 * The four ways a target element can be addressed.
 */
public enum SelectorKind {
    ID("id"),
    CLASS("class"),
    ELEMENT("element"),
    QUERY("query");

    private final String tag;

    SelectorKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
