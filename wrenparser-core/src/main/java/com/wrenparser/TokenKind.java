package com.wrenparser;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The kinds of token the lexer produces.
 */
public enum TokenKind {
    // Punctuators
    LEFT_PAREN("leftParen"),
    RIGHT_PAREN("rightParen"),
    LEFT_BRACKET("leftBracket"),
    RIGHT_BRACKET("rightBracket"),
    LEFT_BRACE("leftBrace"),
    RIGHT_BRACE("rightBrace"),
    COLON("colon"),
    DOT("dot"),
    DOT_DOT("dotDot"),
    DOT_DOT_DOT("dotDotDot"),
    COMMA("comma"),
    STAR("star"),
    SLASH("slash"),
    PERCENT("percent"),
    PLUS("plus"),
    MINUS("minus"),
    PIPE("pipe"),
    PIPE_PIPE("pipePipe"),
    CARET("caret"),
    AMP("amp"),
    AMP_AMP("ampAmp"),
    QUESTION("question"),
    BANG("bang"),
    TILDE("tilde"),
    EQUAL("equal"),
    LESS("less"),
    LESS_EQUAL("lessEqual"),
    LESS_LESS("lessLess"),
    GREATER("greater"),
    GREATER_EQUAL("greaterEqual"),
    GREATER_GREATER("greaterGreater"),
    EQUAL_EQUAL("equalEqual"),
    BANG_EQUAL("bangEqual"),

    // Keywords
    BREAK("break", true),
    CLASS("class", true),
    CONSTRUCT("construct", true),
    ELSE("else", true),
    FALSE("false", true),
    FOR("for", true),
    FOREIGN("foreign", true),
    IF("if", true),
    IMPORT("import", true),
    IN("in", true),
    IS("is", true),
    NULL("null", true),
    RETURN("return", true),
    STATIC("static", true),
    SUPER("super", true),
    THIS("this", true),
    TRUE("true", true),
    VAR("var", true),
    WHILE("while", true),

    FIELD("field"),
    STATIC_FIELD("staticField"),
    NAME("name"),
    NUMBER("number"),
    STRING("string"),
    INTERPOLATION("interpolation"),
    // A newline, which terminates statements
    LINE("line"),
    ERROR("error"),
    EOF("eof");

    private static final Map<String, TokenKind> KEYWORDS = Arrays.stream(values())
            .filter(TokenKind::isKeyword)
            .collect(Collectors.toUnmodifiableMap(kind -> kind.label, Function.identity()));

    private final String label;
    private final boolean keyword;

    TokenKind(String label) {
        this(label, false);
    }

    TokenKind(String label, boolean keyword) {
        this.label = label;
        this.keyword = keyword;
    }

    /**
     * The short name of this kind, e.g. {@code "dotDot"}, or the keyword's own spelling.
     */
    public String label() {
        return label;
    }

    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Looks up the keyword spelled {@code text}, if there is one.
     */
    public static Optional<TokenKind> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    @Override
    public String toString() {
        return label;
    }
}
