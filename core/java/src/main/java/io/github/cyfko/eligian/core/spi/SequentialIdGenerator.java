package io.github.cyfko.eligian.core.spi;

import java.util.Objects;

/**
 * Deterministic identifiers {@code prefix-1}, {@code prefix-2}, ...
 * <p>
 * Not thread-safe; one instance serves one compilation.
 * </p>
 */
public final class SequentialIdGenerator implements IdGenerator {

    private final String prefix;
    private long counter;

    public SequentialIdGenerator() {
        this("id");
    }

    public SequentialIdGenerator(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public String nextId() {
        counter++;
        return prefix + "-" + counter;
    }
}
