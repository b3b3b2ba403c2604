package org.pragmatica.dfmt;

/**
 * Formatter configuration options.
 *
 * @param indentWidth number of spaces per indentation level when {@code useTabs} is off
 * @param useTabs     indent with one tab per level
 */
public record FormatterConfig(
    int indentWidth,
    boolean useTabs
) {
    public static final FormatterConfig DEFAULT = new FormatterConfig(
        4,
        true
    );

    public FormatterConfig {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + indentWidth);
        }
    }

    /**
     * Text emitted for a single indentation level.
     */
    public String indentUnit() {
        return useTabs
               ? "\t"
               : " ".repeat(indentWidth);
    }
}
