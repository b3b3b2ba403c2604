package org.pragmatica.dfmt.chunk;

import java.util.List;

/**
 * Finished unit of formatted output, carrying the whitespace that precedes it.
 */
public sealed interface Chunk {
    /**
     * Whitespace emitted before this chunk.
     */
    SplitType splitType();

    /**
     * Nesting depth at the time the chunk was started.
     */
    int indentation();

    /**
     * Displayed width, in grapheme clusters.
     */
    int length();

    /**
     * Span that was open when the chunk was started, {@code null} outside any span.
     */
    Span span();

    boolean isEmpty();

    Chunk withSpan(Span span);

    /**
     * A chunk outside of any span that starts on a new line is a place where a layout pass can
     * restart line breaking from scratch.
     */
    default boolean endsBreakableLine() {
        return span() == null && splitType().isNewLine();
    }

    /**
     * Literal text. The text never starts or ends with whitespace; whitespace is carried by
     * {@link #splitType()}.
     */
    record Text(SplitType splitType, int indentation, int length, Span span, String text) implements Chunk {
        @Override
        public boolean isEmpty() {
            return text.isEmpty();
        }

        @Override
        public Text withSpan(Span newSpan) {
            return new Text(splitType, indentation, length, newSpan, text);
        }

        @Override
        public String toString() {
            return "Chunk(" + splitType + ", " + Span.print(span) + ", " + indentation + ", " + length + ", ["
                   + text + "])";
        }
    }

    /**
     * Group of chunks that a layout pass may wrap as a unit.
     */
    record Block(SplitType splitType, int indentation, int length, Span span, List<Chunk> chunks) implements Chunk {
        public Block {
            chunks = List.copyOf(chunks);
        }

        @Override
        public boolean isEmpty() {
            return chunks.isEmpty();
        }

        @Override
        public Block withSpan(Span newSpan) {
            return new Block(splitType, indentation, length, newSpan, chunks);
        }

        @Override
        public String toString() {
            return "Chunk(" + splitType + ", " + Span.print(span) + ", " + indentation + ", " + length + ", "
                   + chunks + ")";
        }
    }

    static Text text(SplitType splitType, int indentation, Span span, String text) {
        return new Text(splitType, indentation, Graphemes.length(text), span, text);
    }

    static Block block(SplitType splitType, int indentation, Span span, List<Chunk> chunks) {
        int length = chunks.stream()
                           .mapToInt(Chunk::length)
                           .sum();
        return new Block(splitType, indentation, length, span, chunks);
    }
}
