package org.pragmatica.dfmt.chunk;

/**
 * Whitespace preceding a chunk. Split types are totally ordered by {@link #rank()} and
 * concurrent requests are merged with {@link #strongest(SplitType, SplitType)}.
 */
public enum SplitType {
    NONE(0),
    SPACE(1),
    NEW_LINE(2),
    TWO_NEW_LINES(3);

    private final int rank;

    SplitType(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isStrongerThan(SplitType other) {
        return rank > other.rank;
    }

    public boolean isNewLine() {
        return this == NEW_LINE || this == TWO_NEW_LINES;
    }

    public static SplitType strongest(SplitType a, SplitType b) {
        return b.isStrongerThan(a)
               ? b
               : a;
    }

    /**
     * Line break directive for a request of {@code lines} newlines.
     */
    public static SplitType forNewLines(int lines) {
        return lines > 1
               ? TWO_NEW_LINES
               : NEW_LINE;
    }
}
