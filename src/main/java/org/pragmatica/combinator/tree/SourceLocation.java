package org.pragmatica.combinator.tree;

/**
 * A position in the input (line and column 1-based, offset 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public SourceLocation {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException("Invalid location " + line + ":" + column + " @" + offset);
        }
    }

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location of the symbol {@code count} positions further on the same line.
     */
    public SourceLocation shift(int count) {
        return new SourceLocation(line, column + count, offset + count);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
