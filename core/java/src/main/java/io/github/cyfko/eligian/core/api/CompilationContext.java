package io.github.cyfko.eligian.core.api;

import io.github.cyfko.eligian.core.spi.IdGenerator;
import io.github.cyfko.eligian.core.spi.UuidIdGenerator;

import java.util.*;

/**
 * State scoped to exactly one compilation.
 * <p>
 * Everything a stage needs besides its input travels through this object: the identifier
 * source, the optional source file name and the action names declared by the program being
 * compiled. The pipeline creates a fresh context for every call, so nothing declared while
 * compiling one program is visible while compiling another.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CompilationContext context = CompilationContext.create(new SequentialIdGenerator(), "intro.eligian");
 * Program program = parser.parse(source, context);
 * IrDocument ir = new AstTransformer(ConfigurationDefaults.eligius()).transform(program, context);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class CompilationContext {

    private final IdGenerator ids;
    private final String sourceFile;
    private final Set<String> declaredActions = new LinkedHashSet<>();

    private CompilationContext(IdGenerator ids, String sourceFile) {
        this.ids = Objects.requireNonNull(ids, "IdGenerator is required");
        this.sourceFile = sourceFile;
    }

    /**
     * @return a context with random UUID identifiers and no source file
     */
    public static CompilationContext create() {
        return new CompilationContext(new UuidIdGenerator(), null);
    }

    /**
     * @param ids        identifier source dedicated to this compilation
     * @param sourceFile source document identifier, may be {@code null}
     * @return a new, empty context
     */
    public static CompilationContext create(IdGenerator ids, String sourceFile) {
        return new CompilationContext(ids, sourceFile);
    }

    public String nextId() {
        return ids.nextId();
    }

    public Optional<String> sourceFile() {
        return Optional.ofNullable(sourceFile);
    }

    /**
     * Records an action name declared by the program under compilation.
     *
     * @param name action name
     * @return {@code false} if the name was already declared
     */
    public boolean declareAction(String name) {
        return declaredActions.add(name);
    }

    public boolean isActionDeclared(String name) {
        return declaredActions.contains(name);
    }

    /**
     * @return the declared action names, in declaration order
     */
    public Set<String> declaredActions() {
        return Collections.unmodifiableSet(declaredActions);
    }
}
