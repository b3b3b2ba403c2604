package org.pragmatica.dfmt.chunk;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkRendererTest {

    @Test
    void render_emptyInput_isEmpty() {
        assertThat(ChunkRenderer.chunkRenderer("\t").render(List.of())).isEmpty();
    }

    @Test
    void render_honorsSplitTypesAndIndentation() {
        var chunks = List.<Chunk>of(Chunk.text(SplitType.NONE, 0, null, "a"),
                                    Chunk.text(SplitType.SPACE, 0, null, "b"),
                                    Chunk.text(SplitType.NEW_LINE, 1, null, "c"),
                                    Chunk.text(SplitType.TWO_NEW_LINES, 0, null, "d"));

        assertThat(ChunkRenderer.chunkRenderer("\t").render(chunks)).isEqualTo("a b\n\tc\n\nd\n");
    }

    @Test
    void render_firstChunkGetsOnlyIndentation() {
        var chunks = List.<Chunk>of(Chunk.text(SplitType.NEW_LINE, 2, null, "x"));

        assertThat(ChunkRenderer.chunkRenderer("  ").render(chunks)).isEqualTo("    x\n");
    }

    @Test
    void render_blockUsesItsOwnWhitespaceForFirstChild() {
        var block = Chunk.block(SplitType.NONE,
                                1,
                                null,
                                List.of(Chunk.text(SplitType.NEW_LINE, 1, null, "a,"),
                                        Chunk.text(SplitType.SPACE, 1, null, "b)")));
        var chunks = List.<Chunk>of(Chunk.text(SplitType.NONE, 0, null, "f("), block);

        assertThat(ChunkRenderer.chunkRenderer("\t").render(chunks)).isEqualTo("f(a, b)\n");
    }
}
