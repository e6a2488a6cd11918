package io.github.cyfko.eligian.core;

import io.github.cyfko.eligian.core.api.CompilationContext;
import io.github.cyfko.eligian.core.api.SourceParser;
import io.github.cyfko.eligian.core.ast.EligianAst.Program;
import io.github.cyfko.eligian.core.compiler.*;
import io.github.cyfko.eligian.core.config.CompileOptions;
import io.github.cyfko.eligian.core.config.CompilerVersion;
import io.github.cyfko.eligian.core.config.ConfigurationDefaults;
import io.github.cyfko.eligian.core.config.OperationRegistry;
import io.github.cyfko.eligian.core.exception.*;
import io.github.cyfko.eligian.core.impl.EligianSourceParser;
import io.github.cyfko.eligian.core.model.CompilationMetadata;
import io.github.cyfko.eligian.core.model.IrDocument;
import io.github.cyfko.eligian.core.model.SourceLocation;
import io.github.cyfko.eligian.core.model.engine.EngineConfiguration;
import io.github.cyfko.eligian.core.spi.IdGenerator;
import io.github.cyfko.eligian.core.spi.UuidIdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point of the Eligian compiler.
 * <p>
 * Every pipeline stage runs synchronously and the first failure aborts the remaining ones. Each
 * entry point throws a {@link CompilationException} subclass, never an untyped exception:
 * unexpected runtime failures are wrapped into the exception type of the stage they occurred in.
 * </p>
 * <p>
 * Each call builds its own {@link CompilationContext} with a fresh {@link IdGenerator}; no state
 * is carried from one compilation to the next, so an instance can be shared.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EligianCompiler compiler = EligianCompiler.create();
 * String json = compiler.compileToJSON("timeline raf\nevent intro at 0..10 { show #title }");
 *
 * IrDocument ir = EligianCompiler.builder()
 *     .idGenerators(SequentialIdGenerator::new)
 *     .build()
 *     .compileToIR(source, CompileOptions.unoptimized());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class EligianCompiler {

    private static final Logger log = Logger.getLogger(EligianCompiler.class.getName());

    private final SourceParser parser;
    private final Supplier<? extends IdGenerator> idGenerators;
    private final Clock clock;
    private final AstTransformer transformer;
    private final TypeChecker typeChecker = new TypeChecker();
    private final ConfigurationResolver resolver = new ConfigurationResolver();
    private final JsonEmitter emitter = new JsonEmitter();

    private EligianCompiler(Builder builder) {
        this.parser = builder.parser;
        this.idGenerators = builder.idGenerators;
        this.clock = builder.clock;
        this.transformer = new AstTransformer(builder.defaults, builder.operations);
    }

    /**
     * @return a compiler with the reference parser, the Eligius operations, random identifiers and the system clock
     */
    public static EligianCompiler create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return this compiler's version and the engine configuration version it targets
     */
    public static CompilerVersion getCompilerVersion() {
        return CompilerVersion.current();
    }

    // ========== parseSource ==========

    public Program parseSource(String text) {
        return parseSource(text, null);
    }

    /**
     * Parses and validates source text.
     *
     * @param text       source text
     * @param sourceFile identifier used in locations only, may be {@code null}
     * @throws ParseException      on lexical or grammatical errors
     * @throws ValidationException on semantic errors
     */
    public Program parseSource(String text, String sourceFile) {
        return parse(text, newContext(sourceFile));
    }

    // ========== compileToIR ==========

    public IrDocument compileToIR(String text) {
        return compileToIR(text, CompileOptions.defaults(), null);
    }

    public IrDocument compileToIR(String text, CompileOptions options) {
        return compileToIR(text, options, null);
    }

    /**
     * Parses, transforms, type checks and, unless disabled, optimizes the source.
     *
     * @return the IR document with compilation metadata attached
     */
    public IrDocument compileToIR(String text, CompileOptions options, String sourceFile) {
        CompileOptions effective = options == null ? CompileOptions.defaults() : options;
        CompilationContext context = newContext(sourceFile);

        Program program = parse(text, context);

        IrDocument document = stage("transform",
                e -> new TransformException(TransformErrorKind.INVALID_EXPRESSION,
                        "Unexpected transform failure: " + e.getMessage(), SourceLocation.unknown()),
                () -> transformer.transform(program, context));
        IrDocument withMetadata = document.withMetadata(new CompilationMetadata(
                CompilerVersion.DSL_VERSION, CompilerVersion.COMPILER_VERSION, Instant.now(clock), sourceFile));

        IrDocument checked = stage("type-check",
                e -> new TypeCheckException("Unexpected type check failure: " + e.getMessage(),
                        SourceLocation.unknown(), null, null),
                () -> typeChecker.check(withMetadata));

        IrDocument result = checked;
        if (effective.optimize()) {
            Optimizer optimizer = new Optimizer(effective.partialFolding());
            result = stage("optimize",
                    e -> new OptimizationException("Unexpected optimizer failure: " + e.getMessage(),
                            "optimize", SourceLocation.unknown()),
                    () -> optimizer.optimize(checked));
        }

        IrDocument compiled = result;
        log.info(() -> String.format("Compiled %s: %d timeline(s), %d timeline action(s), %d action definition(s)",
                sourceFile == null ? "<source>" : sourceFile,
                compiled.timelines().size(),
                compiled.timelines().stream().mapToInt(t -> t.actions().size()).sum(),
                compiled.actions().size()));
        return compiled;
    }

    // ========== compile ==========

    public EngineConfiguration compile(String text) {
        return compile(text, CompileOptions.defaults(), null);
    }

    public EngineConfiguration compile(String text, CompileOptions options) {
        return compile(text, options, null);
    }

    /**
     * Compiles the source into the engine configuration, with every action time resolved to a number.
     *
     * @throws OptimizationException when an action time still references a variable
     */
    public EngineConfiguration compile(String text, CompileOptions options, String sourceFile) {
        IrDocument document = compileToIR(text, options, sourceFile);
        return stage(ConfigurationResolver.PASS_NAME,
                e -> new OptimizationException("Unexpected resolution failure: " + e.getMessage(),
                        ConfigurationResolver.PASS_NAME, SourceLocation.unknown()),
                () -> resolver.resolve(document));
    }

    // ========== compileToJSON ==========

    public String compileToJSON(String text) {
        return compileToJSON(text, CompileOptions.defaults(), null);
    }

    public String compileToJSON(String text, CompileOptions options) {
        return compileToJSON(text, options, null);
    }

    /**
     * @return the engine configuration as JSON, single line when {@link CompileOptions#minify()} is set
     */
    public String compileToJSON(String text, CompileOptions options, String sourceFile) {
        CompileOptions effective = options == null ? CompileOptions.defaults() : options;
        EngineConfiguration configuration = compile(text, effective, sourceFile);
        return stage("emit",
                e -> new EmitException("Unexpected emit failure: " + e.getMessage()),
                () -> emitter.emit(configuration, effective.minify()));
    }

    // ========== Internals ==========

    private CompilationContext newContext(String sourceFile) {
        IdGenerator ids = Objects.requireNonNull(idGenerators.get(), "IdGenerator supplier returned null");
        return CompilationContext.create(ids, sourceFile);
    }

    private Program parse(String text, CompilationContext context) {
        if (text == null) {
            throw new ParseException(ParseErrorKind.SYNTAX, "Source text is required",
                    SourceLocation.unknown().withFile(context.sourceFile().orElse(null)));
        }
        return stage("parse",
                e -> new ParseException(ParseErrorKind.SYNTAX, "Unexpected parser failure: " + e.getMessage(),
                        SourceLocation.unknown()),
                () -> parser.parse(text, context));
    }

    private static <T> T stage(String name, Function<RuntimeException, CompilationException> wrapper, Supplier<T> body) {
        long started = System.nanoTime();
        try {
            T result = body.get();
            log.fine(() -> String.format("Stage %s completed in %.3f ms", name, (System.nanoTime() - started) / 1_000_000d));
            return result;
        } catch (CompilationException e) {
            throw e;
        } catch (RuntimeException e) {
            CompilationException wrapped = wrapper.apply(e);
            if (wrapped.getCause() == null) {
                wrapped.initCause(e);
            }
            throw wrapped;
        }
    }

    /**
     * Builder for {@link EligianCompiler}.
     */
    public static final class Builder {
        private SourceParser parser = new EligianSourceParser();
        private Supplier<? extends IdGenerator> idGenerators = UuidIdGenerator::new;
        private Clock clock = Clock.systemUTC();
        private ConfigurationDefaults defaults = ConfigurationDefaults.eligius();
        private OperationRegistry operations = OperationRegistry.eligius();

        private Builder() {}

        public Builder parser(SourceParser parser) {
            this.parser = Objects.requireNonNull(parser, "parser");
            return this;
        }

        /**
         * @param idGenerators called once per compilation
         */
        public Builder idGenerators(Supplier<? extends IdGenerator> idGenerators) {
            this.idGenerators = Objects.requireNonNull(idGenerators, "idGenerators");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder defaults(ConfigurationDefaults defaults) {
            this.defaults = Objects.requireNonNull(defaults, "defaults");
            return this;
        }

        /**
         * @param operations operations accepted by {@code op} statements
         */
        public Builder operations(OperationRegistry operations) {
            this.operations = Objects.requireNonNull(operations, "operations");
            return this;
        }

        public EligianCompiler build() {
            return new EligianCompiler(this);
        }
    }
}
