package org.pragmatica.dfmt.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates text and whitespace intents into a sequence of {@link Chunk}s.
 *
 * <p>Whitespace is never written eagerly. {@link #space()} and {@link #newline(int)} register a
 * pending intent, merged with {@link SplitType#strongest}, which is resolved by the next
 * {@link #write(String)} or {@link #span(int, int)}. Indentation and spans are acquired through
 * {@link Guard}s and must be released in LIFO order.
 *
 * <p>A builder is single-use: {@link #build()} returns the finished chunks.
 */
public final class ChunkBuilder {
    private final List<Chunk> source = new ArrayList<>();

    // In-progress chunk.
    private final StringBuilder text = new StringBuilder();
    private SplitType splitType = SplitType.NONE;
    private int chunkIndentation;
    private Span chunkSpan;

    private SplitType pendingWhiteSpace = SplitType.NONE;
    private int indentation;
    private Span spanStack;

    public static ChunkBuilder chunkBuilder() {
        return new ChunkBuilder();
    }

    /**
     * Flush the in-progress chunk and return everything emitted so far.
     */
    public List<Chunk> build() {
        split();
        return List.copyOf(source);
    }

    /**
     * Write into the next chunk.
     */
    public void write(String s) {
        emitPendingWhiteSpace();
        text.append(s);
    }

    public void space() {
        setWhiteSpace(SplitType.SPACE);
    }

    public void newline() {
        newline(1);
    }

    public void newline(int lines) {
        setWhiteSpace(SplitType.forNewLines(lines));
    }

    public void clearSplitType() {
        pendingWhiteSpace = SplitType.NONE;
    }

    /**
     * Finish the in-progress chunk. Trailing whitespace in its text turns back into a pending
     * intent; an empty chunk is not emitted.
     */
    public void split() {
        int newLines = 0;
        int last = text.length();
        while (last > 0) {
            char c = text.charAt(last - 1);
            if (!isWhite(c)) {
                break;
            }
            last-- ;
            if (c == ' ') {
                space();
            }
            if (c == '\n') {
                newLines++ ;
            }
        }
        if (newLines > 0) {
            newline(newLines);
        }
        text.setLength(last);

        if (text.length() > 0) {
            source.add(Chunk.text(splitType, chunkIndentation, chunkSpan, text.toString()));
            text.setLength(0);
            splitType = SplitType.NONE;
        }

        chunkIndentation = indentation;
        chunkSpan = spanStack;
    }

    public Guard indent() {
        return indent(1);
    }

    public Guard indent(int level) {
        int oldLevel = indentation;
        indentation = Math.max(0, indentation + level);
        return () -> indentation = oldLevel;
    }

    public Guard unindent() {
        return unindent(1);
    }

    public Guard unindent(int level) {
        return indent(-Math.min(level, indentation));
    }

    public Guard span() {
        return span(Span.DEFAULT_COST, Span.DEFAULT_INDENT);
    }

    /**
     * Open a span nested in the current one. The returned guard must be closed before any span
     * opened earlier.
     */
    public Guard span(int cost, int indent) {
        emitPendingWhiteSpace();

        var span = new Span(spanStack, cost, indent);
        spanStack = span;
        return () -> {
            if (spanStack != span) {
                throw new IllegalStateException("Span " + span + " released out of order, innermost open span is "
                                                + Span.print(spanStack));
            }
            spanStack = span.enclosing();
        };
    }

    /**
     * Move the trailing chunks emitted under the parent of the current span into the current span,
     * and pull the previous sibling span, if any, under the current span.
     *
     * @return whether a span was reparented
     */
    public boolean spliceSpan() {
        if (spanStack == null) {
            throw new IllegalStateException("No open span to splice into");
        }
        var parent = spanStack.enclosing();
        Span insert = null;

        if (chunkSpan != parent) {
            insert = chunkSpan;
        }else {
            chunkSpan = spanStack;
            for (int i = source.size() - 1; i >= 0; i-- ) {
                var chunk = source.get(i);
                if (chunk.span() != parent) {
                    insert = chunk.span();
                    break;
                }
                source.set(i, chunk.withSpan(spanStack));
            }
        }

        while (insert != null && insert.enclosing() != parent) {
            insert = insert.enclosing();
        }

        boolean doSplice = insert != null && insert != spanStack;
        if (doSplice) {
            insert.reparent(spanStack);
        }
        return doSplice;
    }

    public int indentation() {
        return indentation;
    }

    /**
     * Innermost open span, empty when none is open.
     */
    public Optional<Span> currentSpan() {
        return Optional.ofNullable(spanStack);
    }

    public SplitType pendingWhiteSpace() {
        return pendingWhiteSpace;
    }

    private void setWhiteSpace(SplitType st) {
        pendingWhiteSpace = SplitType.strongest(pendingWhiteSpace, st);
    }

    private void emitPendingWhiteSpace() {
        switch (pendingWhiteSpace) {
            case NONE -> {
                return;
            }
            case SPACE -> {
                if (text.length() > 0) {
                    text.append(' ');
                    pendingWhiteSpace = SplitType.NONE;
                }else {
                    split();
                }
            }
            case NEW_LINE, TWO_NEW_LINES -> split();
        }
        splitType = SplitType.strongest(splitType, pendingWhiteSpace);
        pendingWhiteSpace = SplitType.NONE;
    }

    private static boolean isWhite(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
    }
}
