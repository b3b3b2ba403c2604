package org.pragmatica.dfmt.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.dfmt.chunk.Chunk;
import org.pragmatica.dfmt.chunk.ChunkRenderer;
import org.pragmatica.dfmt.chunk.SplitType;
import org.pragmatica.dfmt.lexer.Lexer;
import org.pragmatica.dfmt.lexer.TokenRange;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest {

    private static List<Chunk> parse(String source) {
        return Parser.create(source, Lexer.tokenize(source))
                     .parse();
    }

    private static String render(String source) {
        return ChunkRenderer.chunkRenderer("\t")
                            .render(parse(source));
    }

    private static List<String> texts(List<Chunk> chunks) {
        return chunks.stream()
                     .map(chunk -> ((Chunk.Text) chunk).text())
                     .toList();
    }

    // === Entry conditions ===

    @Test
    void parse_requiresBeginToken() {
        var source = "int x;";
        var range = TokenRange.of(Lexer.tokenize(source));
        range.popFront();

        var parser = Parser.create(source, range);

        assertThatThrownBy(parser::parse).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void parse_isSingleUse() {
        var source = "int x;";
        var parser = Parser.create(source, Lexer.tokenize(source));

        parser.parse();

        assertThatThrownBy(parser::parse).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptySource_producesNoChunks() {
        assertThat(parse("")).isEmpty();
        assertThat(parse("   \n\n")).isEmpty();
    }

    // === Labels ===

    @Test
    void label_followedByNewline_getsOwnLine() {
        var chunks = parse("foo:\n  bar();");

        assertThat(texts(chunks)).containsExactly("foo:", "bar();");
        assertThat(chunks.get(0).splitType()).isEqualTo(SplitType.TWO_NEW_LINES);
        assertThat(chunks.get(1).splitType()).isEqualTo(SplitType.NEW_LINE);
        assertThat(chunks).extracting(Chunk::indentation)
                          .containsOnly(0);
    }

    @Test
    void label_onSameLine_staysInline() {
        assertThat(texts(parse("foo: bar();"))).containsExactly("foo: bar();");
    }

    // === Control flow ===

    @Test
    void ifElseChain_keepsElseOnClosingBraceLine() {
        var chunks = parse("if (x) { y(); } else if (z) { w(); }");

        assertThat(texts(chunks)).containsExactly("if (x) {", "y();", "} else if (z) {", "w();", "}");
        assertThat(chunks).extracting(Chunk::splitType)
                          .containsExactly(SplitType.NONE,
                                           SplitType.NEW_LINE,
                                           SplitType.NEW_LINE,
                                           SplitType.NEW_LINE,
                                           SplitType.NEW_LINE);
        assertThat(chunks).extracting(Chunk::indentation)
                          .containsExactly(0, 1, 0, 1, 0);
        assertThat(render("if (x) { y(); } else if (z) { w(); }"))
        .isEqualTo("if (x) {\n\ty();\n} else if (z) {\n\tw();\n}\n");
    }

    @Test
    void ifWithoutBlock_indentsSingleStatement() {
        assertThat(render("if (x) y(); else z();")).isEqualTo("if (x)\n\ty();\nelse\n\tz();\n");
    }

    @Test
    void doWhile_keepsWhileAfterBrace() {
        assertThat(render("do { x(); } while (y);")).isEqualTo("do {\n\tx();\n} while (y);\n");
    }

    @Test
    void forLoop_keepsHeaderOnOneLine() {
        assertThat(render("for (int i = 0; i < n; i++) { f(i); }"))
        .isEqualTo("for (int i = 0; i < n; i++) {\n\tf(i);\n}\n");
    }

    @Test
    void foreach_separatesHeaderParts() {
        assertThat(render("foreach (x; xs) {}")).isEqualTo("foreach (x; xs) {}\n");
    }

    @Test
    void switch_placesCaseLabelsOneLevelIn() {
        var source = "switch (x) {\ncase 1:\nbreak;\ndefault:\nbreak;\n}";

        assertThat(render(source)).isEqualTo("switch (x) {\n\tcase 1:\n\t\tbreak;\n\tdefault:\n\t\tbreak;\n}\n");
    }

    @Test
    void jumpStatements_keepTheirTarget() {
        assertThat(render("break outer;")).isEqualTo("break outer;\n");
        assertThat(render("goto case;")).isEqualTo("goto case;\n");
        assertThat(render("return;")).isEqualTo("return;\n");
    }

    // === Declarations and expressions ===

    @Test
    void binaryOperators_getSingleSpaces() {
        assertThat(render("x=a+b*c;")).isEqualTo("x = a + b * c;\n");
    }

    @Test
    void cast_isFollowedBySpace() {
        assertThat(render("y = cast(int)x;")).isEqualTo("y = cast(int) x;\n");
    }

    @Test
    void enumDeclaration_putsMembersOnTheirOwnLines() {
        assertThat(render("enum Color { Red, Green }")).isEqualTo("enum Color {\n\tRed,\n\tGreen\n}\n");
    }

    @Test
    void manifestConstant_isTreatedAsStorageClass() {
        assertThat(texts(parse("enum X = 1;"))).containsExactly("enum X = 1;");
    }

    @Test
    void aggregate_withBaseClassList() {
        assertThat(render("class A : B, C {}")).isEqualTo("class A : B, C {}\n");
    }

    @Test
    void argumentList_isWrappedInSpan() {
        var chunks = parse("foo(a, b);");

        assertThat(texts(chunks)).containsExactly("foo(", "a,", "b);");
        assertThat(chunks.get(0).span()).isNull();

        var span = chunks.get(1).span();
        assertThat(span).isNotNull();
        assertThat(span.parent()).isEmpty();
        assertThat(chunks.get(2).span()).isSameAs(span);
        assertThat(chunks).extracting(Chunk::indentation)
                          .containsExactly(0, 1, 1);
    }

    // === Comments ===

    @Test
    void trailingLineComment_staysOnItsLine() {
        assertThat(render("int x; // trailing\nint y;")).isEqualTo("int x; // trailing\nint y;\n");
    }

    @Test
    void blockComment_keepsSurroundingSpaces() {
        assertThat(texts(parse("int /* c */ x;"))).containsExactly("int /* c */ x;");
    }

    // === Unrecognized input ===

    @Test
    void unrecognizedTokens_arePassedThroughWithSameLineComment() {
        var source = "@@ ## // note\nint x;";
        var parser = Parser.create(source, Lexer.tokenize(source));

        var chunks = parser.parse();

        assertThat(texts(chunks)).containsExactly("@@ ## // note", "int x;");
        assertThat(parser.skippedRegions()).hasSize(1);
        assertThat(parser.skippedRegions().get(0).extract(source)).isEqualTo("@@ ## // note\n");
    }

    @Test
    void unparsedDirective_rendersUnchanged() {
        assertThat(render("#line 42")).isEqualTo("#line 42\n");
    }

    @Test
    void pragmaLine_isKeptAndFollowingDeclarationReformatted() {
        assertThat(render("#pragma once\nint   x;")).isEqualTo("#pragma once\nint x;\n");
    }

    @Test
    void skippingInsideList_releasesScopes() {
        var source = "foo(@, b); int y;";
        var parser = Parser.create(source, Lexer.tokenize(source));

        var chunks = parser.parse();

        assertThat(ChunkRenderer.chunkRenderer("\t").render(chunks)).isEqualTo("foo(@, b); int y;\n");
        assertThat(parser.skippedRegions()).extracting(span -> span.extract(source))
                                           .containsExactly("@,", ");");

        var last = chunks.get(chunks.size() - 1);
        assertThat(((Chunk.Text) last).text()).isEqualTo("int y;");
        assertThat(last.span()).isNull();
        assertThat(last.indentation()).isZero();
    }

    @Test
    void skippingInsideNestedListInBlock_releasesScopes() {
        var chunks = parse("void f() { foo(bar(@; } int y;");

        assertThat(texts(chunks)).containsExactly("void f() {", "foo(", "bar(", "@;", "}", "int y;");

        var closingBrace = chunks.get(4);
        assertThat(closingBrace.span()).isNull();
        assertThat(closingBrace.indentation()).isZero();

        var last = chunks.get(5);
        assertThat(last.span()).isNull();
        assertThat(last.indentation()).isZero();
    }

    @Test
    void danglingQualifierAtEndOfInput_passesThrough() {
        assertThat(render("const")).isEqualTo("const\n");
        assertThat(render("immutable")).isEqualTo("immutable\n");
        assertThat(render("int x; ref")).isEqualTo("int x;\nref\n");
        assertThat(texts(parse("int x; shared"))).containsExactly("int x;", "shared");
    }

    @Test
    void skippedRegionEndingInLineComment_keepsBlankLine() {
        assertThat(render("@@ // note\n\nint x;")).isEqualTo("@@ // note\n\nint x;\n");
        assertThat(render("@@ // note\nint x;")).isEqualTo("@@ // note\nint x;\n");
    }

    @Test
    void chunkText_neverStartsOrEndsWithWhitespace() throws IOException {
        String source;
        try (var in = getClass().getResourceAsStream("/voldemort.d")) {
            source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        var chunks = parse(source + "\n@@ weird ## stuff   \n");

        assertThat(texts(chunks)).allSatisfy(text -> {
            assertThat(text).isNotEmpty();
            assertThat(Character.isWhitespace(text.charAt(0))).isFalse();
            assertThat(Character.isWhitespace(text.charAt(text.length() - 1))).isFalse();
        });
    }
}
