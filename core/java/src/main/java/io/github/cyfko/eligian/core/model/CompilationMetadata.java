package io.github.cyfko.eligian.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Provenance information attached to a compiled document.
 * <p>
 * {@code compiledAt} is the only value in a compilation result that depends on the clock; it is
 * excluded when two compilation results are compared structurally.
 * </p>
 *
 * @param dslVersion      version of the DSL grammar
 * @param compilerVersion version of this compiler
 * @param compiledAt      compilation instant, written as ISO-8601
 * @param sourceFile      optional source document identifier
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompilationMetadata(String dslVersion, String compilerVersion, Instant compiledAt, String sourceFile) {
}
