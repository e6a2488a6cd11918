package io.github.cyfko.eligian.core.config;

/**
 * Version information of this compiler.
 *
 * @param compiler     version of the compiler
 * @param engineTarget version of the engine configuration format it emits
 */
public record CompilerVersion(String compiler, String engineTarget) {

    public static final String COMPILER_VERSION = "0.0.1";
    public static final String ENGINE_TARGET_VERSION = "1.1.4";
    public static final String DSL_VERSION = "1.0.0";

    private static final CompilerVersion CURRENT = new CompilerVersion(COMPILER_VERSION, ENGINE_TARGET_VERSION);

    public static CompilerVersion current() {
        return CURRENT;
    }
}
