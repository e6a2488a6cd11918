package io.github.cyfko.eligian.core.config;

/**
 * Flat configuration record for one compilation.
 *
 * <h2>Options</h2>
 * <ul>
 *   <li><strong>optimize</strong>: run constant folding and dead-code elimination (default: {@code true})</li>
 *   <li><strong>minify</strong>: emit single-line JSON; affects formatting only, never content (default: {@code false})</li>
 *   <li><strong>partialFolding</strong>: also fold literal sub-trees located beneath a variable,
 *       e.g. {@code x + (2 * 3)} becomes {@code x + 6} (default: {@code false})</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CompileOptions options = CompileOptions.defaults();     // optimize, pretty printed
 * CompileOptions raw = CompileOptions.unoptimized();      // no rewrite at all
 *
 * CompileOptions custom = CompileOptions.builder()
 *     .minify(true)
 *     .build();
 * }</pre>
 *
 * @param optimize       whether the optimizer stage runs
 * @param minify         whether JSON output is single-line
 * @param partialFolding whether folding descends below variables
 * @author Frank KOSSI
 * @since 0.0.1
 */
public record CompileOptions(boolean optimize, boolean minify, boolean partialFolding) {

    /**
     * Default configuration: optimized, pretty printed, conservative folding.
     *
     * @return default options
     */
    public static CompileOptions defaults() {
        return new CompileOptions(true, false, false);
    }

    /**
     * Configuration that skips the optimizer entirely.
     *
     * @return options with {@code optimize = false}
     */
    public static CompileOptions unoptimized() {
        return new CompileOptions(false, false, false);
    }

    /**
     * Builder initialized exactly as {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link CompileOptions}.
     */
    public static final class Builder {
        private boolean optimize = true;
        private boolean minify = false;
        private boolean partialFolding = false;

        private Builder() {}

        public Builder optimize(boolean optimize) {
            this.optimize = optimize;
            return this;
        }

        public Builder minify(boolean minify) {
            this.minify = minify;
            return this;
        }

        public Builder partialFolding(boolean partialFolding) {
            this.partialFolding = partialFolding;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(optimize, minify, partialFolding);
        }
    }
}
