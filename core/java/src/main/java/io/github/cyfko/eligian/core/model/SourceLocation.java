package io.github.cyfko.eligian.core.model;

/**
 * Position of an IR node in the source text.
 * <p>
 * Lines and columns are 1-based. Every IR node carries a location; nodes that have no concrete
 * syntax behind them use the {@link #unknown()} sentinel {@code (1, 1, 0)}.
 * </p>
 *
 * @param file   source file identifier, may be {@code null}
 * @param line   1-based line number
 * @param column 1-based column number
 * @param length number of characters covered by the node
 * @author Frank KOSSI
 * @since 0.0.1
 */
public record SourceLocation(String file, int line, int column, int length) {

    private static final SourceLocation UNKNOWN = new SourceLocation(null, 1, 1, 0);

    public SourceLocation {
        if (line < 1) {
            throw new IllegalArgumentException("line must be 1-based, got: " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be 1-based, got: " + column);
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative, got: " + length);
        }
    }

    /**
     * @return the {@code (1, 1, 0)} sentinel used when no span is available
     */
    public static SourceLocation unknown() {
        return UNKNOWN;
    }

    public static SourceLocation of(int line, int column, int length) {
        return new SourceLocation(null, line, column, length);
    }

    /**
     * @param file file identifier to attach
     * @return a copy of this location attributed to {@code file}
     */
    public SourceLocation withFile(String file) {
        return new SourceLocation(file, line, column, length);
    }

    /**
     * Formats the location as {@code file:line:column}, or {@code line:column} without file.
     *
     * @return the display form of this location
     */
    public String format() {
        String position = line + ":" + column;
        return file == null ? position : file + ":" + position;
    }
}
