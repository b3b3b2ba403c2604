package org.pragmatica.dfmt.lexer;

import org.pragmatica.dfmt.source.SourceLocation;

import java.util.List;

/**
 * Cursor over a lexed token list.
 *
 * <p>A range starts on the {@link TokenKind#BEGIN} token and ends on {@link TokenKind#END}.
 * Comment tokens are filtered out unless the range was obtained with {@code withComments(true)}.
 * Ranges are cheap to copy with {@link #save()}, which is how lookahead is done.
 */
public final class TokenRange {
    private final List<Token> tokens;
    private final boolean withComments;
    private int index;
    private SourceLocation previous;

    private TokenRange(List<Token> tokens, boolean withComments, int index, SourceLocation previous) {
        this.tokens = tokens;
        this.withComments = withComments;
        this.index = index;
        this.previous = previous;
    }

    /**
     * Create a comment-filtering range positioned on the first token of {@code tokens}.
     */
    public static TokenRange of(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.END)) {
            throw new IllegalArgumentException("Token list must be terminated by an END token");
        }
        var first = tokens.get(0);
        return new TokenRange(List.copyOf(tokens), false, 0, first.span().start());
    }

    public Token front() {
        return tokens.get(index);
    }

    public boolean match(TokenKind kind) {
        return front().is(kind);
    }

    /**
     * End location of the last token popped off this range.
     */
    public SourceLocation previous() {
        return previous;
    }

    public void popFront() {
        if (match(TokenKind.END)) {
            throw new IllegalStateException("Cannot advance past the end of the token stream");
        }
        previous = front().span().end();
        index++ ;
        skipFilteredComments();
    }

    /**
     * Independent copy of this range, for lookahead.
     */
    public TokenRange save() {
        return new TokenRange(tokens, withComments, index, previous);
    }

    /**
     * Copy of this range that surfaces (or filters) comment tokens.
     */
    public TokenRange withComments(boolean comments) {
        var range = new TokenRange(tokens, comments, index, previous);
        range.skipFilteredComments();
        return range;
    }

    public TokenRange withComments() {
        return withComments(true);
    }

    private void skipFilteredComments() {
        if (withComments) {
            return;
        }
        while (match(TokenKind.COMMENT)) {
            index++ ;
        }
    }
}
