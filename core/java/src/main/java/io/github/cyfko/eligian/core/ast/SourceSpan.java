package io.github.cyfko.eligian.core.ast;

/**
 * Concrete-syntax span of a syntax node, as reported by the parser.
 * <p>
 * All coordinates are 0-based; conversion to the 1-based {@link io.github.cyfko.eligian.core.model.SourceLocation}
 * happens in the transformer.
 * </p>
 *
 * @param startLine      0-based line of the first character
 * @param startCharacter 0-based column of the first character
 * @param startOffset    offset of the first character in the source text
 * @param endOffset      offset just past the last character
 */
public record SourceSpan(int startLine, int startCharacter, int startOffset, int endOffset) {

    public SourceSpan {
        if (startLine < 0 || startCharacter < 0 || startOffset < 0) {
            throw new IllegalArgumentException("Span coordinates must not be negative");
        }
        if (endOffset < startOffset) {
            throw new IllegalArgumentException("Span end " + endOffset + " precedes start " + startOffset);
        }
    }

    public int length() {
        return endOffset - startOffset;
    }

    /**
     * @param end a span ending after this one
     * @return a span from the start of this span to the end of {@code end}
     */
    public SourceSpan to(SourceSpan end) {
        return new SourceSpan(startLine, startCharacter, startOffset, Math.max(endOffset, end.endOffset));
    }
}
