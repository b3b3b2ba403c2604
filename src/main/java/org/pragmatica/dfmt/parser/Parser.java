package org.pragmatica.dfmt.parser;

import org.pragmatica.dfmt.chunk.Chunk;
import org.pragmatica.dfmt.chunk.ChunkBuilder;
import org.pragmatica.dfmt.chunk.Guard;
import org.pragmatica.dfmt.lexer.Token;
import org.pragmatica.dfmt.lexer.TokenKind;
import org.pragmatica.dfmt.lexer.TokenRange;
import org.pragmatica.dfmt.source.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.pragmatica.dfmt.lexer.TokenKind.*;

/**
 * Tolerant recognizer for D source.
 *
 * <p>This is not a validating parser. It recognizes common patterns of the language well enough
 * to decide where whitespace and line breaks belong, without checking that the program is
 * correct, so code that is still being written can be formatted. Tokens it cannot make sense of
 * are copied to the output exactly as they appear in the source.
 *
 * <p>A parser is single-use: create it over a token stream positioned on
 * {@link TokenKind#BEGIN} and call {@link #parse()} once.
 */
public final class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenKind> BINARY_OPERATORS = EnumSet.of(
    EQUAL, PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, PERCENT_EQUAL, AMPERSAND_EQUAL, PIPE_EQUAL,
    CARET_EQUAL, TILDE_EQUAL, LESS_LESS_EQUAL, MORE_MORE_EQUAL, MORE_MORE_MORE_EQUAL, CARET_CARET_EQUAL,
    PIPE_PIPE, AMPERSAND_AMPERSAND, PIPE, CARET, AMPERSAND, EQUAL_EQUAL, BANG_EQUAL, MORE, MORE_EQUAL, LESS,
    LESS_EQUAL, BANG_LESS_MORE_EQUAL, BANG_LESS_MORE, LESS_MORE, LESS_MORE_EQUAL, BANG_MORE, BANG_MORE_EQUAL,
    BANG_LESS, BANG_LESS_EQUAL, IS, IN, BANG, LESS_LESS, MORE_MORE, MORE_MORE_MORE, PLUS, MINUS, TILDE, SLASH,
    STAR, PERCENT);

    private final String source;
    private final TokenRange trange;
    private final ChunkBuilder builder = ChunkBuilder.chunkBuilder();
    private final List<SourceSpan> skippedRegions = new ArrayList<>();

    private Mode mode = Mode.DECLARATION;

    /**
     * Tokens we could not parse, forwarded as they are once parsing resumes.
     * {@code null} when nothing is being skipped.
     */
    private SourceSpan skipped;

    private Parser(String source, TokenRange trange) {
        this.source = source;
        this.trange = trange.withComments();
    }

    public static Parser create(String source, List<Token> tokens) {
        return create(source, TokenRange.of(tokens));
    }

    public static Parser create(String source, TokenRange trange) {
        return new Parser(source, trange);
    }

    public List<Chunk> parse() {
        expect(BEGIN);

        // Eat the begin token and get the game rolling.
        nextToken();
        parseModule();

        expect(END);

        emitSkippedTokens();
        return builder.build();
    }

    /**
     * Source regions that were passed through verbatim, in source order.
     */
    public List<SourceSpan> skippedRegions() {
        return List.copyOf(skippedRegions);
    }

    // === Token Processing ===

    private int newLineCount(TokenRange r) {
        return r.front()
                .span()
                .start()
                .line() - r.previous()
                           .line();
    }

    private int newLineCount() {
        return newLineCount(trange);
    }

    private int whiteSpaceLength() {
        return token().span()
                      .start()
                      .offset() - trange.previous()
                                        .offset();
    }

    private Token token() {
        return trange.front();
    }

    private void nextToken() {
        emitSkippedTokens();

        // Process current token.
        builder.write(token().text());

        if (match(END)) {
            // We reached the end of our input.
            return;
        }

        trange.popFront();
        emitComments();
    }

    /**
     * We skip over portions of the code we can't parse.
     */
    private void skipToken() {
        if (skipped == null) {
            emitSourceBasedWhiteSpace();
            split();

            log.trace("Skipping unrecognized input from {}", token().span().start());
            skipped = token().span();
        }else {
            skipped = skipped.spanTo(token().span());
        }

        trange.popFront();

        // Skip over comments that look related too.
        while (match(COMMENT) && newLineCount() == 0 && !endsLine(skipped)) {
            skipped = skipped.spanTo(token().span());
            trange.popFront();
        }

        emitComments();
    }

    private boolean endsLine(SourceSpan span) {
        return !span.isEmpty() && source.charAt(span.end()
                                                    .offset() - 1) == '\n';
    }

    private void emitSkippedTokens() {
        if (skipped == null) {
            return;
        }

        builder.write(skipped.extract(source));
        skippedRegions.add(skipped);

        if (endsLine(skipped)) {
            // The line comment closing the region already consumed one newline.
            newline(newLineCount() + 1);
        }else {
            emitSourceBasedWhiteSpace();
        }
        skipped = null;
        split();
    }

    // === Comments management ===

    private void emitComments() {
        if (!match(COMMENT)) {
            return;
        }

        emitSkippedTokens();
        emitSourceBasedWhiteSpace();

        while (match(COMMENT)) {
            var comment = token().text();
            builder.write(comment);

            trange.popFront();

            if (comment.startsWith("//")) {
                newline(newLineCount() + 1);
            }else {
                emitSourceBasedWhiteSpace();
            }
        }
    }

    // === Chunk builder facilities ===

    private void space() {
        builder.space();
    }

    private void newline() {
        newline(newLineCount());
    }

    private void newline(int lines) {
        builder.newline(lines);
    }

    private void clearSplitType() {
        builder.clearSplitType();
    }

    private void split() {
        builder.split();
    }

    private void emitSourceBasedWhiteSpace() {
        int lines = newLineCount();
        if (lines > 0) {
            newline(lines);
        }else if (whiteSpaceLength() > 0) {
            space();
        }
    }

    private Guard changeMode(Mode m) {
        var oldMode = mode;
        mode = m;
        return () -> mode = oldMode;
    }

    // === Parser utilities ===

    private boolean match(TokenKind kind) {
        return trange.match(kind);
    }

    private void nextTokenIf(TokenKind kind) {
        if (match(kind)) {
            nextToken();
        }
    }

    private void expect(TokenKind... kinds) {
        for (var kind : kinds) {
            if (match(kind)) {
                return;
            }
        }
        throw new IllegalStateException("Expected one of " + List.of(kinds) + " but found " + token());
    }

    // === Parsing ===

    private void parseModule() {
        try (var guard = changeMode(Mode.DECLARATION)) {
            while (!match(END)) {
                parseStructuralElement();
            }
        }
    }

    private void parseStructuralElement() {
        if (!parseStructuralElementBody()) {
            return;
        }

        boolean foundSemicolon = match(SEMICOLON);
        if (foundSemicolon) {
            nextToken();
        }

        if (mode != Mode.PARAMETER) {
            if (foundSemicolon) {
                newline();
            }else {
                emitSourceBasedWhiteSpace();
            }
        }
    }

    /**
     * @return whether the element can be followed by a separator
     */
    private boolean parseStructuralElementBody() {
        while (true) {
            switch (token().kind()) {
                case END -> {
                    return false;
                }
                case MODULE -> parseModuleDeclaration();

                // Statements
                case OPEN_BRACE -> {
                    parseBlock(mode);
                    // Blocks do not end with a semicolon.
                    return false;
                }
                case IDENTIFIER -> {
                    if (!parseLabel()) {
                        // This is an expression or a declaration.
                        return parseDefault();
                    }
                }
                case IF -> parseIf();
                case ELSE -> parseElse();
                case WHILE -> parseWhile();
                case DO -> parseDoWhile();
                case FOR -> parseFor();
                case FOREACH, FOREACH_REVERSE -> parseForeach();
                case RETURN -> parseReturn();
                case BREAK, CONTINUE -> {
                    nextToken();
                    if (match(IDENTIFIER)) {
                        space();
                        nextToken();
                    }
                }
                case SWITCH -> parseSwitch();
                case CASE -> parseCase();
                case DEFAULT -> parseDefaultLabel();
                case GOTO -> parseGoto();
                case ASSERT -> parseExpression();

                // Declarations
                case THIS -> parseConstructor();
                case STATIC -> {
                    nextToken();
                    space();
                    continue;
                }
                case ENUM -> {
                    if (isEnumDeclaration()) {
                        parseEnum();
                    }else {
                        parseStorageClass();
                    }
                }
                case REF -> {
                    nextToken();
                    space();
                    return parseDefault();
                }
                case ABSTRACT, ALIGN, AUTO, DEPRECATED, EXTERN, FINAL, NOTHROW, OVERRIDE, PURE, SCOPE, SYNCHRONIZED ->
                parseStorageClass();
                case STRUCT, UNION, CLASS, INTERFACE -> parseAggregate();
                case ALIAS -> parseAlias();
                default -> {
                    return parseDefault();
                }
            }
            return true;
        }
    }

    /**
     * Expression, declaration, or something we don't know about.
     */
    private boolean parseDefault() {
        if (!parseIdentifier()) {
            if (match(END)) {
                // Input ends mid-declaration, there is nothing left to skip.
                return false;
            }
            // We made no progress, start skipping.
            skipToken();
            return false;
        }

        switch (token().kind()) {
            case STAR -> {
                var lookahead = trange.save()
                                      .withComments(false);
                lookahead.popFront();
                if (lookahead.match(IDENTIFIER)) {
                    // This is a pointer type.
                    nextToken();
                    parseTypedDeclaration();
                }
            }
            case IDENTIFIER -> parseTypedDeclaration();
            default -> {}
        }

        // We just have some kind of expression.
        parseBinaryExpression();
        return true;
    }

    /**
     * An identifier followed by a colon. Looking one token past the colon tells whether the label
     * sits on its own line.
     */
    private boolean parseLabel() {
        var lookahead = trange.save()
                              .withComments(false);
        lookahead.popFront();
        if (!lookahead.match(COLON)) {
            return false;
        }

        lookahead.popFront();
        if (newLineCount(lookahead) > 0) {
            try (var guard = builder.unindent()) {
                newline(2);
                nextToken();
                nextToken();
                newline();
            }
        }else {
            nextToken();
            nextToken();
            space();
        }
        return true;
    }

    // === Structural elements ===

    private void parseModuleDeclaration() {
        expect(MODULE);
        nextToken();
        space();
        parseIdentifier();
    }

    // === Identifiers ===

    private boolean parseIdentifier() {
        boolean prefix = parseIdentifierPrefix();
        boolean base = parseBaseIdentifier();
        return prefix || base;
    }

    private boolean parseIdentifierPrefix() {
        boolean progress = false;
        while (true) {
            switch (token().kind()) {
                case DOT, AMPERSAND, PLUS_PLUS, MINUS_MINUS, STAR, PLUS, MINUS, BANG, TILDE -> nextToken();
                case CAST -> {
                    nextToken();
                    if (match(OPEN_PAREN)) {
                        nextToken();
                        parseType();
                    }
                    nextTokenIf(CLOSE_PAREN);
                    space();
                }
                default -> {
                    return progress;
                }
            }
            progress = true;
        }
    }

    private boolean parseBaseIdentifier() {
        while (true) {
            switch (token().kind()) {
                case IDENTIFIER -> nextToken();

                // Literals
                case THIS, SUPER, TRUE, FALSE, NULL, INTEGER_LITERAL, FLOAT_LITERAL, STRING_LITERAL,
                     CHARACTER_LITERAL, FILE_KEYWORD, LINE_KEYWORD, DOLLAR -> nextToken();
                case ASSERT, TYPEOF, TYPEID -> {
                    nextToken();
                    parseArgumentList();
                }
                case OPEN_PAREN, OPEN_BRACKET -> parseArgumentList();

                // Types
                case BOOL, BYTE, UBYTE, SHORT, USHORT, INT, UINT, LONG, ULONG, CENT, UCENT, CHAR, WCHAR, DCHAR,
                     FLOAT, DOUBLE, REAL, VOID -> nextToken();

                // Type qualifiers
                case CONST, IMMUTABLE, INOUT, SHARED -> {
                    nextToken();
                    if (!match(OPEN_PAREN)) {
                        space();
                        continue;
                    }
                    nextToken();
                    parseType();
                    nextTokenIf(CLOSE_PAREN);
                }
                default -> {
                    return false;
                }
            }

            parseIdentifierSuffix();
            return true;
        }
    }

    private boolean parseIdentifierSuffix() {
        boolean progress = false;
        while (true) {
            switch (token().kind()) {
                case DOT -> {
                    nextToken();
                    // Chained access goes back through the base identifier.
                    parseBaseIdentifier();
                    return true;
                }
                case BANG -> {
                    nextToken();
                    if (match(OPEN_PAREN)) {
                        parseArgumentList();
                    }
                }
                case PLUS_PLUS, MINUS_MINUS -> nextToken();
                case OPEN_PAREN, OPEN_BRACKET -> parseArgumentList();
                default -> {
                    return progress;
                }
            }
            progress = true;
        }
    }

    // === Statements ===

    private void parseBlock(Mode m) {
        parseBlock(m, 1);
    }

    private void parseBlock(Mode m, int indentLevel) {
        if (!match(OPEN_BRACE)) {
            return;
        }

        nextToken();
        if (match(CLOSE_BRACE)) {
            nextToken();
            newline();
            return;
        }

        try (var indentGuard = builder.indent(indentLevel); var modeGuard = changeMode(m)) {
            newline(1);
            split();

            while (!match(CLOSE_BRACE) && !match(END)) {
                parseStructuralElement();
            }
        }

        if (match(CLOSE_BRACE)) {
            clearSplitType();
            newline(1);
            nextToken();
            newline(2);
        }
    }

    private boolean parseControlFlowBlock() {
        return parseControlFlowBlock(1);
    }

    private boolean parseControlFlowBlock(int indentLevel) {
        boolean isBlock = match(OPEN_BRACE);
        if (isBlock) {
            parseBlock(mode, indentLevel);
        }else {
            try (var guard = builder.indent()) {
                newline(1);
                parseStructuralElement();
            }
        }
        return isBlock;
    }

    private boolean parseControlFlowBase() {
        return parseControlFlowBase(1);
    }

    private boolean parseControlFlowBase(int indentLevel) {
        nextToken();
        space();

        parseParenthesizedCondition();

        space();
        return parseControlFlowBlock(indentLevel);
    }

    private void parseParenthesizedCondition() {
        if (!match(OPEN_PAREN)) {
            return;
        }
        nextToken();
        try (var guard = changeMode(Mode.PARAMETER)) {
            parseStructuralElement();
            nextTokenIf(CLOSE_PAREN);
        }
    }

    /**
     * Keep the next keyword on the line of a closing brace, or put it on its own line after a
     * single statement body.
     */
    private void emitBlockControlFlowWhitespace(boolean isBlock) {
        clearSplitType();
        if (isBlock) {
            space();
        }else {
            newline(1);
        }
    }

    private void parseIf() {
        expect(IF);
        boolean isBlock = parseControlFlowBase();
        if (!match(ELSE)) {
            return;
        }

        emitBlockControlFlowWhitespace(isBlock);
        parseElse();
    }

    private void parseElse() {
        expect(ELSE);
        space();
        nextToken();
        space();

        if (match(IF)) {
            parseIf();
        }else {
            parseControlFlowBlock();
        }
    }

    private void parseWhile() {
        expect(WHILE);
        parseControlFlowBase();
    }

    private void parseDoWhile() {
        expect(DO);
        nextToken();
        space();
        boolean isBlock = parseControlFlowBlock();

        if (!match(WHILE)) {
            return;
        }

        emitBlockControlFlowWhitespace(isBlock);
        nextToken();
        space();

        parseParenthesizedCondition();

        nextTokenIf(SEMICOLON);
        newline(2);
    }

    private void parseFor() {
        expect(FOR);
        nextToken();
        space();

        if (match(OPEN_PAREN)) {
            nextToken();
            if (match(SEMICOLON)) {
                nextToken();
            }else {
                parseStructuralElement();
                clearSplitType();
            }

            if (match(SEMICOLON)) {
                nextToken();
            }else {
                space();
                parseExpression();
                nextTokenIf(SEMICOLON);
            }

            if (match(CLOSE_PAREN)) {
                nextToken();
            }else {
                space();
                parseExpression();
            }

            nextTokenIf(CLOSE_PAREN);
        }

        space();
        parseControlFlowBlock();
    }

    private void parseForeach() {
        expect(FOREACH, FOREACH_REVERSE);
        nextToken();
        space();

        if (match(OPEN_PAREN)) {
            nextToken();
            try (var guard = changeMode(Mode.PARAMETER)) {
                parseList(this::parseStructuralElement, SEMICOLON, false);

                space();
                parseList(this::parseExpression, CLOSE_PAREN, false);
            }
        }

        space();
        parseControlFlowBlock();
    }

    private void parseReturn() {
        expect(RETURN);
        nextToken();
        if (!match(SEMICOLON)) {
            space();
            parseExpression();
        }
    }

    private void parseSwitch() {
        expect(SWITCH);
        // Case labels are unindented by one level, so the body gets two.
        parseControlFlowBase(2);
    }

    private void parseCase() {
        expect(CASE);
        try (var guard = builder.unindent()) {
            newline();
            nextToken();
            space();

            parseList(this::parseExpression, COLON, false);
            newline();
        }
    }

    private void parseDefaultLabel() {
        expect(DEFAULT);
        try (var guard = builder.unindent()) {
            newline();
            nextToken();
            nextTokenIf(COLON);
            newline();
        }
    }

    private void parseGoto() {
        expect(GOTO);
        nextToken();
        if (match(IDENTIFIER) || match(CASE) || match(DEFAULT)) {
            space();
            nextToken();
        }
    }

    // === Types ===

    private void parseType() {
        parseIdentifier();

        do {
            // '*' could be a pointer or a multiply, so it is not parsed eagerly.
            nextTokenIf(STAR);
        } while (parseIdentifierSuffix());
    }

    // === Expressions ===

    private void parseExpression() {
        parseBaseExpression();
        parseBinaryExpression();
    }

    private void parseBaseExpression() {
        parseIdentifier();
    }

    /**
     * A '?' ends the expression: the conditional operator is not told apart from a default
     * branch, so it is left to the surrounding element.
     */
    private void parseBinaryExpression() {
        while (BINARY_OPERATORS.contains(token().kind())) {
            space();
            nextToken();
            space();

            parseBaseExpression();
        }
    }

    private boolean parseArgumentList() {
        return parseList(this::parseExpression);
    }

    // === Declarations ===

    private void parseTypedDeclaration() {
        expect(IDENTIFIER);

        boolean loop = mode == Mode.PARAMETER;
        do {
            space();
            nextTokenIf(IDENTIFIER);

            // Template parameters, then runtime parameters.
            boolean parameters = parseParameterList();
            while (parameters) {
                parameters = parseParameterList();
            }

            // Function declaration.
            if (match(OPEN_BRACE)) {
                space();
                parseBlock(Mode.STATEMENT);
                return;
            }

            // Variable, template parameters, whatever.
            while (match(EQUAL) || match(COLON)) {
                space();
                nextToken();
                space();
                parseExpression();
            }

            if (!match(COMMA)) {
                break;
            }

            nextToken();
        } while (loop);
    }

    private void parseConstructor() {
        expect(THIS);
        nextToken();

        boolean parameters = parseParameterList();
        while (parameters) {
            parameters = parseParameterList();
        }

        // Function declaration.
        if (match(OPEN_BRACE)) {
            space();
            parseBlock(Mode.STATEMENT);
        }
    }

    private boolean parseParameterList() {
        try (var guard = changeMode(Mode.PARAMETER)) {
            return parseList(this::parseStructuralElement);
        }
    }

    private void parseStorageClass() {
        while (true) {
            switch (token().kind()) {
                case ABSTRACT, AUTO, ALIAS, DEPRECATED, FINAL, NOTHROW, OVERRIDE, PURE, STATIC, CONST, IMMUTABLE,
                     INOUT, SHARED, GSHARED, ENUM -> {
                    nextToken();
                    space();
                }
                case ALIGN, EXTERN, SCOPE, SYNCHRONIZED -> {
                    nextToken();
                    parseArgumentList();
                    space();
                }
                default -> {
                    return;
                }
            }

            switch (token().kind()) {
                case COLON -> {
                    clearSplitType();
                    nextToken();
                    newline(1);
                    return;
                }
                case OPEN_BRACE -> {
                    space();
                    parseBlock(mode);
                    return;
                }
                case IDENTIFIER -> {
                    var lookahead = trange.save()
                                          .withComments(false);
                    lookahead.popFront();

                    switch (lookahead.front()
                                     .kind()) {
                        case EQUAL, OPEN_PAREN -> parseTypedDeclaration();
                        default -> parseStructuralElement();
                    }
                    return;
                }
                default -> {}
            }
        }
    }

    private boolean isEnumDeclaration() {
        var lookahead = trange.save()
                              .withComments(false);
        lookahead.popFront();

        if (lookahead.match(IDENTIFIER)) {
            lookahead.popFront();
        }
        return lookahead.match(COLON) || lookahead.match(OPEN_BRACE);
    }

    private void parseEnum() {
        expect(ENUM);
        nextToken();

        if (match(IDENTIFIER)) {
            space();
            nextToken();
        }

        if (match(COLON)) {
            space();
            nextToken();
            space();
            parseType();
        }

        if (match(OPEN_BRACE)) {
            space();
            nextToken();
            parseList(this::parseExpression, CLOSE_BRACE, true);
        }
    }

    private void parseAggregate() {
        expect(STRUCT, UNION, CLASS, INTERFACE);
        nextToken();
        space();

        nextTokenIf(IDENTIFIER);

        parseArgumentList();
        space();

        if (match(COLON)) {
            split();
            nextToken();
            space();
            parseBaseClassList();
        }

        parseBlock(Mode.DECLARATION);
    }

    private void parseBaseClassList() {
        while (true) {
            parseType();
            if (!match(COMMA)) {
                break;
            }
            nextToken();
            space();
        }
        space();
    }

    private void parseAlias() {
        expect(ALIAS);
        nextToken();
        space();

        nextTokenIf(IDENTIFIER);

        parseArgumentList();
        space();

        switch (token().kind()) {
            case THIS -> nextToken();
            case EQUAL -> {
                nextToken();
                space();
                parseExpression();
            }
            default -> {}
        }
    }

    // === Parsing utilities ===

    private boolean parseList(Runnable fun) {
        var closing = switch (token().kind()) {
            case OPEN_PAREN -> CLOSE_PAREN;
            case OPEN_BRACKET -> CLOSE_BRACKET;
            default -> null;
        };
        if (closing == null) {
            return false;
        }

        nextToken();
        return parseList(fun, closing, false);
    }

    private boolean parseList(Runnable fun, TokenKind closing, boolean addNewLines) {
        if (match(closing)) {
            nextToken();
            return true;
        }

        if (addNewLines) {
            parseListElements(fun, true);
        }else {
            // Inline lists are the places where the layout pass may break lines.
            try (var span = builder.span()) {
                parseListElements(fun, false);
            }
        }

        if (match(closing)) {
            if (addNewLines) {
                newline(1);
            }

            nextToken();
        }

        if (addNewLines) {
            newline(2);
        }

        return true;
    }

    private void parseListElements(Runnable fun, boolean addNewLines) {
        while (true) {
            try (var guard = builder.indent()) {
                while (true) {
                    if (addNewLines) {
                        newline(1);
                    }else {
                        split();
                    }

                    fun.run();

                    if (!match(COMMA)) {
                        break;
                    }

                    nextToken();
                    space();
                }

                if (!match(DOT_DOT)) {
                    break;
                }

                space();
                nextToken();
                space();
            }
        }
    }
}
