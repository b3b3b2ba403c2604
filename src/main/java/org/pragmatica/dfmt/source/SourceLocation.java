package org.pragmatica.dfmt.source;

/**
 * A position in source text: line and column are 1-based, offset is the 0-based
 * index of the character in the source string.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
