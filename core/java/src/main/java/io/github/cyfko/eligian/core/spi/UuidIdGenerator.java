package io.github.cyfko.eligian.core.spi;

import java.util.UUID;

/**
 * Random UUID v4 identifiers, globally unique so that configurations can be merged safely.
 */
public final class UuidIdGenerator implements IdGenerator {

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
