package org.pragmatica.dfmt;

import org.pragmatica.dfmt.chunk.Chunk;
import org.pragmatica.dfmt.source.SourceSpan;

import java.util.List;

/**
 * Result of formatting a source file.
 *
 * <p>Recognition never fails: input the recognizer could not make sense of is carried verbatim
 * inside the chunks and reported in {@code skipped}.
 *
 * @param chunks  The formatted chunk sequence
 * @param skipped Source regions passed through verbatim, in source order
 * @param source  The original source text
 */
public record FormatResult(
    List<Chunk> chunks,
    List<SourceSpan> skipped,
    String source
) {
    public FormatResult {
        chunks = List.copyOf(chunks);
        skipped = List.copyOf(skipped);
    }

    /**
     * Check if every token was recognized.
     */
    public boolean isFullyRecognized() {
        return skipped.isEmpty();
    }

    /**
     * Source text of each skipped region.
     */
    public List<String> skippedText() {
        return skipped.stream()
                      .map(span -> span.extract(source))
                      .toList();
    }
}
