package org.pragmatica.dfmt.lexer;

import org.pragmatica.dfmt.source.SourceLocation;
import org.pragmatica.dfmt.source.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Tolerant lexer for D source text.
 *
 * <p>The lexer never rejects malformed input: unterminated literals and comments run to the end
 * of the input and unknown characters become {@link TokenKind#INVALID} tokens, so the recognizer
 * can pass them through verbatim. Comments are kept as {@link TokenKind#COMMENT} tokens; a line
 * comment includes its terminating newline.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 16_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 256;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>(DEFAULT_TOKEN_CAPACITY);
        tokens.add(new Token(TokenKind.BEGIN, SourceSpan.at(SourceLocation.START), ""));
        while (!isAtEnd()) {
            skipWhitespace();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new Token(TokenKind.END, SourceSpan.at(currentLocation()), ""));
        return tokens;
    }

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();
        if (c == '/' && pos + 1 < input.length()) {
            char next = peekAt(1);
            if (next == '/') {
                return scanLineComment(start);
            }
            if (next == '*') {
                return scanBlockComment(start);
            }
            if (next == '+') {
                return scanNestedComment(start);
            }
        }
        // Prefixed strings: r"...", x"...", q"..."
        if ((c == 'r' || c == 'x' || c == 'q') && pos + 1 < input.length() && peekAt(1) == '"') {
            advance();
            return c == 'r' || c == 'q'
                   ? scanWysiwygString(start, '"')
                   : scanEscapedString(start);
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(peekAt(1)))) {
            return scanNumber(start);
        }
        if (c == '"') {
            return scanEscapedString(start);
        }
        if (c == '`') {
            return scanWysiwygString(start, '`');
        }
        if (c == '\'') {
            return scanCharacter(start);
        }
        return scanOperator(start);
    }

    private Token scanLineComment(SourceLocation start) {
        while (!isAtEnd()) {
            if (advance() == '\n') {
                break;
            }
        }
        return token(TokenKind.COMMENT, start);
    }

    private Token scanBlockComment(SourceLocation start) {
        advance();
        advance();
        // skip /*
        while (!isAtEnd()) {
            if (peek() == '*' && pos + 1 < input.length() && peekAt(1) == '/') {
                advance();
                advance();
                break;
            }
            advance();
        }
        return token(TokenKind.COMMENT, start);
    }

    private Token scanNestedComment(SourceLocation start) {
        advance();
        advance();
        // skip /+
        int depth = 1;
        while (!isAtEnd() && depth > 0) {
            char c = advance();
            if (c == '/' && !isAtEnd() && peek() == '+') {
                advance();
                depth++ ;
            }else if (c == '+' && !isAtEnd() && peek() == '/') {
                advance();
                depth-- ;
            }
        }
        return token(TokenKind.COMMENT, start);
    }

    private Token scanIdentifier(SourceLocation start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        var word = input.substring(start.offset(), pos);
        return new Token(TokenKind.keywordOrIdentifier(word), span(start), word);
    }

    private Token scanNumber(SourceLocation start) {
        boolean isFloat = false;
        if (peek() == '0' && pos + 1 < input.length() && (peekAt(1) == 'x' || peekAt(1) == 'X')) {
            advance();
            advance();
            // skip 0x
            while (!isAtEnd() && (isHexDigit(peek()) || peek() == '_')) {
                advance();
            }
            isFloat = scanFraction(true) | scanExponent('p', 'P');
        }else if (peek() == '0' && pos + 1 < input.length() && (peekAt(1) == 'b' || peekAt(1) == 'B')) {
            advance();
            advance();
            // skip 0b
            while (!isAtEnd() && (peek() == '0' || peek() == '1' || peek() == '_')) {
                advance();
            }
        }else {
            while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
                advance();
            }
            isFloat = scanFraction(false) | scanExponent('e', 'E');
        }
        while (!isAtEnd() && isNumberSuffix(peek())) {
            char suffix = advance();
            if (suffix == 'f' || suffix == 'F' || suffix == 'i') {
                isFloat = true;
            }
        }
        return token(isFloat
                     ? TokenKind.FLOAT_LITERAL
                     : TokenKind.INTEGER_LITERAL,
                     start);
    }

    /**
     * A fraction needs a digit after the dot, so {@code 1..2} and {@code 1.foo} stay integers.
     */
    private boolean scanFraction(boolean hex) {
        if (isAtEnd() || peek() != '.' || pos + 1 >= input.length()) {
            return false;
        }
        char next = peekAt(1);
        if (!(hex
              ? isHexDigit(next)
              : isDigit(next))) {
            return false;
        }
        advance();
        while (!isAtEnd() && ((hex
                               ? isHexDigit(peek())
                               : isDigit(peek())) || peek() == '_')) {
            advance();
        }
        return true;
    }

    private boolean scanExponent(char lower, char upper) {
        if (isAtEnd() || (peek() != lower && peek() != upper)) {
            return false;
        }
        int sign = pos + 1 < input.length() && (peekAt(1) == '+' || peekAt(1) == '-')
                   ? 1
                   : 0;
        if (pos + 1 + sign >= input.length() || !isDigit(peekAt(1 + sign))) {
            return false;
        }
        advance();
        if (sign == 1) {
            advance();
        }
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            advance();
        }
        return true;
    }

    private Token scanEscapedString(SourceLocation start) {
        advance();
        // skip opening quote
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
            }
            advance();
        }
        if (!isAtEnd()) {
            advance();
            // skip closing quote
            scanStringPostfix();
        }
        return token(TokenKind.STRING_LITERAL, start);
    }

    private Token scanWysiwygString(SourceLocation start, char quote) {
        advance();
        // skip opening quote
        while (!isAtEnd() && peek() != quote) {
            advance();
        }
        if (!isAtEnd()) {
            advance();
            // skip closing quote
            scanStringPostfix();
        }
        return token(TokenKind.STRING_LITERAL, start);
    }

    private void scanStringPostfix() {
        if (!isAtEnd() && (peek() == 'c' || peek() == 'w' || peek() == 'd')) {
            if (pos + 1 >= input.length() || !isIdentifierPart(peekAt(1))) {
                advance();
            }
        }
    }

    private Token scanCharacter(SourceLocation start) {
        advance();
        // skip opening quote
        while (!isAtEnd() && peek() != '\'' && peek() != '\n') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
            }
            advance();
        }
        if (!isAtEnd() && peek() == '\'') {
            advance();
        }
        return token(TokenKind.CHARACTER_LITERAL, start);
    }

    private Token scanOperator(SourceLocation start) {
        int longest = Math.min(TokenKind.MAX_OPERATOR_LENGTH, input.length() - pos);
        for (int length = longest; length > 0; length-- ) {
            var kind = TokenKind.operator(input.substring(pos, pos + length));
            if (kind != null) {
                for (int i = 0; i < length; i++ ) {
                    advance();
                }
                return token(kind, start);
            }
        }
        // Keep surrogate pairs together so an invalid token is one code point.
        if (Character.isHighSurrogate(advance()) && !isAtEnd() && Character.isLowSurrogate(peek())) {
            advance();
        }
        return token(TokenKind.INVALID, start);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        return input.charAt(pos + offset);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        }else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private Token token(TokenKind kind, SourceLocation start) {
        var span = span(start);
        return new Token(kind, span, span.extract(input));
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || (c > 0x7F && Character.isLetter(c));
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isNumberSuffix(char c) {
        return c == 'L' || c == 'u' || c == 'U' || c == 'f' || c == 'F' || c == 'i';
    }
}
