package org.pragmatica.dfmt.chunk;

import java.util.Optional;

/**
 * Node of the span tree. A span attributes a line break cost and a continuation indent to the
 * run of chunks emitted while it was open.
 *
 * <p>Spans compare by identity. The parent link is only rewritten by
 * {@link ChunkBuilder#spliceSpan()}.
 */
public final class Span {
    public static final int DEFAULT_COST = 1;
    public static final int DEFAULT_INDENT = 1;

    private Span parent;
    private final int cost;
    private final int indent;

    Span(Span parent, int cost, int indent) {
        this.parent = parent;
        this.cost = cost;
        this.indent = indent;
    }

    /**
     * Enclosing span, empty at the root.
     */
    public Optional<Span> parent() {
        return Optional.ofNullable(parent);
    }

    Span enclosing() {
        return parent;
    }

    public int cost() {
        return cost;
    }

    public int indent() {
        return indent;
    }

    /**
     * Whether {@code other} is this span or one of its ancestors.
     */
    public boolean isWithin(Span other) {
        for (var span = this; span != null; span = span.parent) {
            if (span == other) {
                return true;
            }
        }
        return false;
    }

    void reparent(Span newParent) {
        this.parent = newParent;
    }

    static String print(Span span) {
        return span == null
               ? "null"
               : span.toString();
    }

    @Override
    public String toString() {
        return "Span(" + print(parent) + ", " + cost + ", " + indent + ")";
    }
}
