package io.github.cyfko.eligian.core.impl;

import io.github.cyfko.eligian.core.api.CompilationContext;
import io.github.cyfko.eligian.core.api.SourceParser;
import io.github.cyfko.eligian.core.ast.EligianAst.Program;
import io.github.cyfko.eligian.core.parsing.Lexer;
import io.github.cyfko.eligian.core.parsing.RecursiveDescentParser;
import io.github.cyfko.eligian.core.parsing.SemanticValidator;
import io.github.cyfko.eligian.core.parsing.Token;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link SourceParser}: tokenizes, parses and validates Eligian source text.
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public class EligianSourceParser implements SourceParser {

    private static final Logger log = Logger.getLogger(EligianSourceParser.class.getName());

    private final int maxNestingDepth;

    public EligianSourceParser() {
        this(RecursiveDescentParser.DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param maxNestingDepth nesting limit for values and time expressions
     * @throws IllegalArgumentException if {@code maxNestingDepth} is not positive
     */
    public EligianSourceParser(int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    @Override
    public Program parse(String source, CompilationContext context) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(context, "context");
        String file = context.sourceFile().orElse(null);

        List<Token> tokens = new Lexer(source, file).tokenize();
        log.fine(() -> String.format("Tokenized %d characters into %d tokens", source.length(), tokens.size()));

        Program program = new RecursiveDescentParser(tokens, file, maxNestingDepth).parseProgram();
        new SemanticValidator(context).validate(program);
        return program;
    }
}
