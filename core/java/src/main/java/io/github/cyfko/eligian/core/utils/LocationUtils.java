package io.github.cyfko.eligian.core.utils;

import io.github.cyfko.eligian.core.ast.EligianAst;
import io.github.cyfko.eligian.core.ast.SourceSpan;
import io.github.cyfko.eligian.core.model.SourceLocation;

/**
 * Converts 0-based parser spans into 1-based source locations.
 *
 * @author Frank KOSSI
 * @since 0.0.1
 */
public final class LocationUtils {

    private LocationUtils() {}

    /**
     * @param span the parser span, may be {@code null}
     * @param file source file identifier, may be {@code null}
     * @return the 1-based location, or the {@code (1, 1, 0)} sentinel when {@code span} is {@code null}
     */
    public static SourceLocation locate(SourceSpan span, String file) {
        if (span == null) {
            return SourceLocation.unknown();
        }
        return new SourceLocation(file, span.startLine() + 1, span.startCharacter() + 1, span.length());
    }

    /**
     * @param node syntax node, may be {@code null}
     * @param file source file identifier, may be {@code null}
     * @return the 1-based location of {@code node}
     */
    public static SourceLocation locate(EligianAst.Node node, String file) {
        return node == null ? SourceLocation.unknown() : locate(node.span(), file);
    }
}
