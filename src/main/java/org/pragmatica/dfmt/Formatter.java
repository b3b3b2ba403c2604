package org.pragmatica.dfmt;

import org.pragmatica.dfmt.chunk.ChunkRenderer;
import org.pragmatica.dfmt.lexer.Lexer;
import org.pragmatica.dfmt.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for formatting D source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var formatter = Formatter.builder()
 *                          .useTabs(false)
 *                          .indentWidth(2)
 *                          .build();
 *
 * var text = formatter.formatToString("void main(){writeln(1);}");
 * }</pre>
 */
public final class Formatter {
    private static final Logger log = LoggerFactory.getLogger(Formatter.class);

    private final FormatterConfig config;

    private Formatter(FormatterConfig config) {
        this.config = config;
    }

    public static Formatter formatter() {
        return formatter(FormatterConfig.DEFAULT);
    }

    public static Formatter formatter(FormatterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Formatter configuration is required");
        }
        return new Formatter(config);
    }

    public FormatterConfig config() {
        return config;
    }

    /**
     * Lex and recognize {@code source} into chunks.
     */
    public FormatResult format(String source) {
        var tokens = Lexer.tokenize(source);
        log.debug("Lexed {} tokens", tokens.size());

        var parser = Parser.create(source, tokens);
        var chunks = parser.parse();
        var result = new FormatResult(chunks, parser.skippedRegions(), source);

        log.debug("Built {} chunks", chunks.size());
        result.skipped()
              .forEach(span -> log.debug("Passed through unrecognized input at {}", span));
        return result;
    }

    /**
     * Format {@code source} and render it without line wrapping.
     */
    public String formatToString(String source) {
        return ChunkRenderer.chunkRenderer(config.indentUnit())
                            .render(format(source).chunks());
    }

    /**
     * Create a builder for custom formatter configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int indentWidth = FormatterConfig.DEFAULT.indentWidth();
        private boolean useTabs = FormatterConfig.DEFAULT.useTabs();

        private Builder() {}

        public Builder indentWidth(int width) {
            this.indentWidth = width;
            return this;
        }

        public Builder useTabs(boolean tabs) {
            this.useTabs = tabs;
            return this;
        }

        public Formatter build() {
            return formatter(new FormatterConfig(indentWidth, useTabs));
        }
    }
}
