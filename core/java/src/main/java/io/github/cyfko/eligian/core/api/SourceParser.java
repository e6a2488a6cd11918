package io.github.cyfko.eligian.core.api;

import io.github.cyfko.eligian.core.ast.EligianAst.Program;
import io.github.cyfko.eligian.core.exception.ParseException;
import io.github.cyfko.eligian.core.exception.ValidationException;

/**
 * Turns Eligian source text into a validated syntax tree.
 * <p>
 * The compilation core only consumes the tree; any parser producing
 * {@link io.github.cyfko.eligian.core.ast.EligianAst} nodes can be plugged into the pipeline.
 * Implementations must report lexical and grammatical failures as {@link ParseException} and
 * semantic failures as {@link ValidationException}, and must not keep state between calls.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * SourceParser parser = new EligianSourceParser();
 *
 * Program program = parser.parse("timeline raf\nevent intro at 0..10 { show #title }",
 *                                CompilationContext.create());
 *
 * parser.parse("timeline raf \u0000", context);     // ParseException (LEXICAL)
 * parser.parse("event intro at 0..5 { }", context); // ValidationException (TIMELINE_REQUIRED)
 * parser.parse("timeline vhs", context);            // ValidationException (INVALID_PROVIDER)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public interface SourceParser {

    /**
     * Parses and validates source text.
     *
     * @param source  the program text, must not be {@code null}
     * @param context the context of the current compilation
     * @return the program syntax tree
     * @throws ParseException      if the text cannot be tokenized or does not match the grammar
     * @throws ValidationException if the program is grammatical but semantically invalid
     * @throws NullPointerException if {@code source} or {@code context} is {@code null}
     */
    Program parse(String source, CompilationContext context) throws ParseException, ValidationException;
}
