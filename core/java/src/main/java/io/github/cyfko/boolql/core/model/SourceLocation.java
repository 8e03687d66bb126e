package io.github.cyfko.boolql.core.model;

/**
 * Position of a character in a BoolQL source text.
 * <p>
 * Attached to every {@link Token} and to every error raised while compiling an
 * expression, so that callers can point at the offending character.
 * </p>
 *
 * @param line   1-indexed line number
 * @param column 1-indexed column number
 * @param offset 0-indexed character offset from the start of the source
 * @since 1.0.0
 */
public record SourceLocation(int line, int column, int offset) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a coordinate is out of range
     */
    public SourceLocation {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got: " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1, got: " + column);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
    }

    /**
     * Location of the first character of a source.
     *
     * @return location {@code 1:1} at offset 0
     */
    public static SourceLocation start() {
        return new SourceLocation(1, 1, 0);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
