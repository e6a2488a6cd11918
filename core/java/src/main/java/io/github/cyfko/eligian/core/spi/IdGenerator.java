package io.github.cyfko.eligian.core.spi;

/**
 * Source of the unique identifiers assigned to documents, timelines, actions and operations.
 * <p>
 * The transformer is the only stage that draws identifiers. The pipeline obtains a new
 * generator for every compilation, so a generator never carries state from one compilation to
 * the next.
 * </p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link UuidIdGenerator}: random UUID v4, the production default</li>
 *   <li>{@link SequentialIdGenerator}: deterministic {@code prefix-1, prefix-2, ...}, for tests and reproducible builds</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * @return a new identifier, never returned before by this generator
     */
    String nextId();
}
