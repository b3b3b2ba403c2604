package org.pragmatica.dfmt.lexer;

import org.pragmatica.dfmt.source.SourceSpan;

/**
 * A lexed token. {@code text} is the exact source slice covered by {@code span}.
 */
public record Token(TokenKind kind, SourceSpan span, String text) {

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + span.start();
    }
}
