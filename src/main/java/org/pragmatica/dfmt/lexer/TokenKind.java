package org.pragmatica.dfmt.lexer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kinds of D tokens. Keywords and operators carry their fixed spelling.
 */
public enum TokenKind {
    // Stream sentinels
    BEGIN(Category.SPECIAL, null),
    END(Category.SPECIAL, null),

    // Trivia and garbage
    COMMENT(Category.SPECIAL, null),
    INVALID(Category.SPECIAL, null),

    // Identifiers and literals
    IDENTIFIER(Category.SPECIAL, null),
    INTEGER_LITERAL(Category.SPECIAL, null),
    FLOAT_LITERAL(Category.SPECIAL, null),
    STRING_LITERAL(Category.SPECIAL, null),
    CHARACTER_LITERAL(Category.SPECIAL, null),

    // Operators and delimiters
    SLASH(Category.OPERATOR, "/"),
    SLASH_EQUAL(Category.OPERATOR, "/="),
    DOT(Category.OPERATOR, "."),
    DOT_DOT(Category.OPERATOR, ".."),
    DOT_DOT_DOT(Category.OPERATOR, "..."),
    AMPERSAND(Category.OPERATOR, "&"),
    AMPERSAND_EQUAL(Category.OPERATOR, "&="),
    AMPERSAND_AMPERSAND(Category.OPERATOR, "&&"),
    PIPE(Category.OPERATOR, "|"),
    PIPE_EQUAL(Category.OPERATOR, "|="),
    PIPE_PIPE(Category.OPERATOR, "||"),
    MINUS(Category.OPERATOR, "-"),
    MINUS_EQUAL(Category.OPERATOR, "-="),
    MINUS_MINUS(Category.OPERATOR, "--"),
    PLUS(Category.OPERATOR, "+"),
    PLUS_EQUAL(Category.OPERATOR, "+="),
    PLUS_PLUS(Category.OPERATOR, "++"),
    LESS(Category.OPERATOR, "<"),
    LESS_EQUAL(Category.OPERATOR, "<="),
    LESS_LESS(Category.OPERATOR, "<<"),
    LESS_LESS_EQUAL(Category.OPERATOR, "<<="),
    LESS_MORE(Category.OPERATOR, "<>"),
    LESS_MORE_EQUAL(Category.OPERATOR, "<>="),
    MORE(Category.OPERATOR, ">"),
    MORE_EQUAL(Category.OPERATOR, ">="),
    MORE_MORE(Category.OPERATOR, ">>"),
    MORE_MORE_EQUAL(Category.OPERATOR, ">>="),
    MORE_MORE_MORE(Category.OPERATOR, ">>>"),
    MORE_MORE_MORE_EQUAL(Category.OPERATOR, ">>>="),
    BANG(Category.OPERATOR, "!"),
    BANG_EQUAL(Category.OPERATOR, "!="),
    BANG_LESS(Category.OPERATOR, "!<"),
    BANG_LESS_EQUAL(Category.OPERATOR, "!<="),
    BANG_LESS_MORE(Category.OPERATOR, "!<>"),
    BANG_LESS_MORE_EQUAL(Category.OPERATOR, "!<>="),
    BANG_MORE(Category.OPERATOR, "!>"),
    BANG_MORE_EQUAL(Category.OPERATOR, "!>="),
    OPEN_PAREN(Category.OPERATOR, "("),
    CLOSE_PAREN(Category.OPERATOR, ")"),
    OPEN_BRACKET(Category.OPERATOR, "["),
    CLOSE_BRACKET(Category.OPERATOR, "]"),
    OPEN_BRACE(Category.OPERATOR, "{"),
    CLOSE_BRACE(Category.OPERATOR, "}"),
    QUESTION_MARK(Category.OPERATOR, "?"),
    COMMA(Category.OPERATOR, ","),
    SEMICOLON(Category.OPERATOR, ";"),
    COLON(Category.OPERATOR, ":"),
    DOLLAR(Category.OPERATOR, "$"),
    EQUAL(Category.OPERATOR, "="),
    EQUAL_EQUAL(Category.OPERATOR, "=="),
    EQUAL_MORE(Category.OPERATOR, "=>"),
    STAR(Category.OPERATOR, "*"),
    STAR_EQUAL(Category.OPERATOR, "*="),
    PERCENT(Category.OPERATOR, "%"),
    PERCENT_EQUAL(Category.OPERATOR, "%="),
    CARET(Category.OPERATOR, "^"),
    CARET_EQUAL(Category.OPERATOR, "^="),
    CARET_CARET(Category.OPERATOR, "^^"),
    CARET_CARET_EQUAL(Category.OPERATOR, "^^="),
    TILDE(Category.OPERATOR, "~"),
    TILDE_EQUAL(Category.OPERATOR, "~="),
    AT(Category.OPERATOR, "@"),
    HASH(Category.OPERATOR, "#"),

    // Keywords
    ABSTRACT(Category.KEYWORD, "abstract"),
    ALIAS(Category.KEYWORD, "alias"),
    ALIGN(Category.KEYWORD, "align"),
    ASM(Category.KEYWORD, "asm"),
    ASSERT(Category.KEYWORD, "assert"),
    AUTO(Category.KEYWORD, "auto"),
    BODY(Category.KEYWORD, "body"),
    BOOL(Category.KEYWORD, "bool"),
    BREAK(Category.KEYWORD, "break"),
    BYTE(Category.KEYWORD, "byte"),
    CASE(Category.KEYWORD, "case"),
    CAST(Category.KEYWORD, "cast"),
    CATCH(Category.KEYWORD, "catch"),
    CENT(Category.KEYWORD, "cent"),
    CHAR(Category.KEYWORD, "char"),
    CLASS(Category.KEYWORD, "class"),
    CONST(Category.KEYWORD, "const"),
    CONTINUE(Category.KEYWORD, "continue"),
    DCHAR(Category.KEYWORD, "dchar"),
    DEBUG(Category.KEYWORD, "debug"),
    DEFAULT(Category.KEYWORD, "default"),
    DELEGATE(Category.KEYWORD, "delegate"),
    DELETE(Category.KEYWORD, "delete"),
    DEPRECATED(Category.KEYWORD, "deprecated"),
    DO(Category.KEYWORD, "do"),
    DOUBLE(Category.KEYWORD, "double"),
    ELSE(Category.KEYWORD, "else"),
    ENUM(Category.KEYWORD, "enum"),
    EXPORT(Category.KEYWORD, "export"),
    EXTERN(Category.KEYWORD, "extern"),
    FALSE(Category.KEYWORD, "false"),
    FINAL(Category.KEYWORD, "final"),
    FINALLY(Category.KEYWORD, "finally"),
    FLOAT(Category.KEYWORD, "float"),
    FOR(Category.KEYWORD, "for"),
    FOREACH(Category.KEYWORD, "foreach"),
    FOREACH_REVERSE(Category.KEYWORD, "foreach_reverse"),
    FUNCTION(Category.KEYWORD, "function"),
    GOTO(Category.KEYWORD, "goto"),
    IF(Category.KEYWORD, "if"),
    IMMUTABLE(Category.KEYWORD, "immutable"),
    IMPORT(Category.KEYWORD, "import"),
    IN(Category.KEYWORD, "in"),
    INOUT(Category.KEYWORD, "inout"),
    INT(Category.KEYWORD, "int"),
    INTERFACE(Category.KEYWORD, "interface"),
    INVARIANT(Category.KEYWORD, "invariant"),
    IS(Category.KEYWORD, "is"),
    LAZY(Category.KEYWORD, "lazy"),
    LONG(Category.KEYWORD, "long"),
    MACRO(Category.KEYWORD, "macro"),
    MIXIN(Category.KEYWORD, "mixin"),
    MODULE(Category.KEYWORD, "module"),
    NEW(Category.KEYWORD, "new"),
    NOTHROW(Category.KEYWORD, "nothrow"),
    NULL(Category.KEYWORD, "null"),
    OUT(Category.KEYWORD, "out"),
    OVERRIDE(Category.KEYWORD, "override"),
    PACKAGE(Category.KEYWORD, "package"),
    PRAGMA(Category.KEYWORD, "pragma"),
    PRIVATE(Category.KEYWORD, "private"),
    PROTECTED(Category.KEYWORD, "protected"),
    PUBLIC(Category.KEYWORD, "public"),
    PURE(Category.KEYWORD, "pure"),
    REAL(Category.KEYWORD, "real"),
    REF(Category.KEYWORD, "ref"),
    RETURN(Category.KEYWORD, "return"),
    SCOPE(Category.KEYWORD, "scope"),
    SHARED(Category.KEYWORD, "shared"),
    SHORT(Category.KEYWORD, "short"),
    STATIC(Category.KEYWORD, "static"),
    STRUCT(Category.KEYWORD, "struct"),
    SUPER(Category.KEYWORD, "super"),
    SWITCH(Category.KEYWORD, "switch"),
    SYNCHRONIZED(Category.KEYWORD, "synchronized"),
    TEMPLATE(Category.KEYWORD, "template"),
    THIS(Category.KEYWORD, "this"),
    THROW(Category.KEYWORD, "throw"),
    TRUE(Category.KEYWORD, "true"),
    TRY(Category.KEYWORD, "try"),
    TYPEID(Category.KEYWORD, "typeid"),
    TYPEOF(Category.KEYWORD, "typeof"),
    UBYTE(Category.KEYWORD, "ubyte"),
    UCENT(Category.KEYWORD, "ucent"),
    UINT(Category.KEYWORD, "uint"),
    ULONG(Category.KEYWORD, "ulong"),
    UNION(Category.KEYWORD, "union"),
    UNITTEST(Category.KEYWORD, "unittest"),
    USHORT(Category.KEYWORD, "ushort"),
    VERSION(Category.KEYWORD, "version"),
    VOID(Category.KEYWORD, "void"),
    WCHAR(Category.KEYWORD, "wchar"),
    WHILE(Category.KEYWORD, "while"),
    WITH(Category.KEYWORD, "with"),
    FILE_KEYWORD(Category.KEYWORD, "__FILE__"),
    LINE_KEYWORD(Category.KEYWORD, "__LINE__"),
    GSHARED(Category.KEYWORD, "__gshared"),
    TRAITS(Category.KEYWORD, "__traits"),
    VECTOR(Category.KEYWORD, "__vector"),
    PARAMETERS(Category.KEYWORD, "__parameters");

    /**
     * Broad classification of a token kind.
     */
    public enum Category {
        SPECIAL,
        OPERATOR,
        KEYWORD
    }

    static final int MAX_OPERATOR_LENGTH = 4;

    private static final Map<String, TokenKind> KEYWORDS = new HashMap<>();
    private static final Map<String, TokenKind> OPERATORS = new HashMap<>();

    static {
        for (var kind : values()) {
            switch (kind.category) {
                case KEYWORD -> KEYWORDS.put(kind.spelling, kind);
                case OPERATOR -> OPERATORS.put(kind.spelling, kind);
                default -> {}
            }
        }
    }

    private final Category category;
    private final String spelling;

    TokenKind(Category category, String spelling) {
        this.category = category;
        this.spelling = spelling;
    }

    public Category category() {
        return category;
    }

    /**
     * Fixed spelling of keywords and operators, {@code null} for the other kinds.
     */
    public String spelling() {
        return spelling;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    public boolean isOperator() {
        return category == Category.OPERATOR;
    }

    /**
     * Keyword spelled {@code word}, or {@link #IDENTIFIER} when it is not a keyword.
     */
    public static TokenKind keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word, IDENTIFIER);
    }

    /**
     * Operator spelled exactly {@code text}, or {@code null}.
     */
    static TokenKind operator(String text) {
        return OPERATORS.get(text);
    }
}
