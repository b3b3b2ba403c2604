package org.pragmatica.dfmt.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.dfmt.lexer.TokenKind.*;

class LexerTest {

    private static List<TokenKind> kinds(String source) {
        return Lexer.tokenize(source)
                    .stream()
                    .map(Token::kind)
                    .toList();
    }

    private static List<String> texts(String source) {
        return Lexer.tokenize(source)
                    .stream()
                    .map(Token::text)
                    .toList();
    }

    @Test
    void emptyInput_onlyBeginAndEnd() {
        var tokens = Lexer.tokenize("");

        assertThat(tokens).extracting(Token::kind)
                          .containsExactly(BEGIN, END);
        assertThat(tokens.get(1).span().start().offset()).isZero();
    }

    @Test
    void keywordsAndIdentifiers_areDistinguished() {
        assertThat(kinds("if foo __FILE__ __gshared"))
        .containsExactly(BEGIN, IF, IDENTIFIER, FILE_KEYWORD, GSHARED, END);
    }

    @Test
    void operators_useLongestMatch() {
        assertThat(kinds("a >>>= b")).containsExactly(BEGIN, IDENTIFIER, MORE_MORE_MORE_EQUAL, IDENTIFIER, END);
        assertThat(kinds("x !<>= y")).containsExactly(BEGIN, IDENTIFIER, BANG_LESS_MORE_EQUAL, IDENTIFIER, END);
        assertThat(kinds("...")).containsExactly(BEGIN, DOT_DOT_DOT, END);
    }

    @Test
    void integerRange_isNotAFloat() {
        assertThat(kinds("1..2")).containsExactly(BEGIN, INTEGER_LITERAL, DOT_DOT, INTEGER_LITERAL, END);
    }

    @Test
    void numbers_classifiedByShape() {
        assertThat(kinds("0x1F 0b101 42UL 1.5 2e10 3f .5"))
        .containsExactly(BEGIN, INTEGER_LITERAL, INTEGER_LITERAL, INTEGER_LITERAL, FLOAT_LITERAL, FLOAT_LITERAL,
                         FLOAT_LITERAL, FLOAT_LITERAL, END);
    }

    @Test
    void lineComment_includesNewline() {
        var tokens = Lexer.tokenize("// note\nx");

        assertThat(tokens.get(1).kind()).isEqualTo(COMMENT);
        assertThat(tokens.get(1).text()).isEqualTo("// note\n");
        assertThat(tokens.get(2).span().start().line()).isEqualTo(2);
    }

    @Test
    void nestedComment_balancesDelimiters() {
        assertThat(texts("/+ a /+ b +/ c +/x")).containsExactly("", "/+ a /+ b +/ c +/", "x", "");
    }

    @Test
    void strings_keepPrefixAndPostfix() {
        assertThat(texts("r\"a\\b\" `raw` \"esc\\\"aped\"w 'c'"))
        .containsExactly("", "r\"a\\b\"", "`raw`", "\"esc\\\"aped\"w", "'c'", "");
    }

    @Test
    void unterminatedString_runsToEndOfInput() {
        var tokens = Lexer.tokenize("x = \"abc");

        assertThat(tokens.get(3).kind()).isEqualTo(STRING_LITERAL);
        assertThat(tokens.get(3).text()).isEqualTo("\"abc");
    }

    @Test
    void unknownCharacter_becomesInvalidToken() {
        assertThat(kinds("a § b")).containsExactly(BEGIN, IDENTIFIER, INVALID, IDENTIFIER, END);
    }

    @Test
    void tokenText_isExactSourceSlice() {
        var source = "auto x = foo!(int)(1, 2);  // done\n";

        for (var token : Lexer.tokenize(source)) {
            assertThat(token.span().extract(source)).isEqualTo(token.text());
        }
    }

    @Test
    void locations_trackLinesAndColumns() {
        var tokens = Lexer.tokenize("a\n  b");

        assertThat(tokens.get(2).span().start().line()).isEqualTo(2);
        assertThat(tokens.get(2).span().start().column()).isEqualTo(3);
        assertThat(tokens.get(2).span().start().offset()).isEqualTo(4);
    }

    @Test
    void oversizedInput_isRejected() {
        var huge = "x".repeat(16_000_001);

        assertThatThrownBy(() -> Lexer.tokenize(huge)).isInstanceOf(IllegalArgumentException.class);
    }
}
