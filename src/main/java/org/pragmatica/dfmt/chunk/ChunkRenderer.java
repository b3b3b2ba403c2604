package org.pragmatica.dfmt.chunk;

import java.util.List;

/**
 * Renders chunks as text, honoring split types and indentation only. No line is ever wrapped,
 * so spans are ignored; this is the output of the formatter before any layout pass.
 */
public final class ChunkRenderer {
    private final String indentUnit;

    private ChunkRenderer(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public static ChunkRenderer chunkRenderer(String indentUnit) {
        return new ChunkRenderer(indentUnit);
    }

    public String render(List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        indent(sb, chunks.get(0).indentation());
        renderContent(sb, chunks.get(0));
        for (var chunk : chunks.subList(1, chunks.size())) {
            renderChunk(sb, chunk);
        }
        return sb.append('\n')
                 .toString();
    }

    private void renderChunk(StringBuilder sb, Chunk chunk) {
        switch (chunk.splitType()) {
            case NONE -> {}
            case SPACE -> sb.append(' ');
            case NEW_LINE -> indent(sb.append('\n'), chunk.indentation());
            case TWO_NEW_LINES -> indent(sb.append("\n\n"), chunk.indentation());
        }
        renderContent(sb, chunk);
    }

    /**
     * A block's whitespace stands for its first child's.
     */
    private void renderContent(StringBuilder sb, Chunk chunk) {
        if (chunk instanceof Chunk.Text text) {
            sb.append(text.text());
            return;
        }
        var children = ((Chunk.Block) chunk).chunks();
        if (children.isEmpty()) {
            return;
        }
        renderContent(sb, children.get(0));
        for (var child : children.subList(1, children.size())) {
            renderChunk(sb, child);
        }
    }

    private void indent(StringBuilder sb, int level) {
        sb.append(indentUnit.repeat(level));
    }
}
