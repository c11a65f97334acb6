package com.wrenparser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.wrenparser.TokenKind.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestLexer {

    private static List<Token> tokens(String text) {
        return new Lexer(new SourceBuffer("test.wren", text)).tokenize();
    }

    private static List<Token> strictTokens(String text) {
        return new Lexer(new SourceBuffer("test.wren", text), true).tokenize();
    }

    private static List<TokenKind> kinds(String text) {
        return tokens(text).stream().map(Token::kind).collect(Collectors.toList());
    }

    @Test
    void testMaximalMunchDots() {
        assertEquals(List.of(DOT, EOF), kinds("."));
        assertEquals(List.of(DOT_DOT, EOF), kinds(".."));
        assertEquals(List.of(DOT_DOT_DOT, EOF), kinds("..."));
        assertEquals(List.of(DOT_DOT_DOT, DOT, EOF), kinds("...."));
    }

    @Test
    void testMaximalMunchOperators() {
        assertEquals(List.of(PIPE, NAME, EOF), kinds("|a"));
        assertEquals(List.of(PIPE_PIPE, EOF), kinds("||"));
        assertEquals(List.of(AMP, AMP_AMP, EOF), kinds("& &&"));
        assertEquals(List.of(BANG, BANG_EQUAL, EOF), kinds("! !="));
        assertEquals(List.of(EQUAL, EQUAL_EQUAL, EOF), kinds("= =="));
        assertEquals(List.of(LESS, LESS_LESS, LESS_EQUAL, EOF), kinds("< << <="));
        assertEquals(List.of(GREATER, GREATER_GREATER, GREATER_EQUAL, EOF), kinds("> >> >="));
        assertEquals(List.of(EQUAL_EQUAL, EQUAL, EOF), kinds("==="));
    }

    @Test
    void testSingleCharacterPunctuators() {
        assertEquals(
            List.of(LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
                    COLON, COMMA, STAR, SLASH, PERCENT, PLUS, MINUS, TILDE, CARET, QUESTION, EOF),
            kinds("()[]{}:,*/%+-~^?"));
    }

    @Test
    void testInterpolationWaitsForBalancedParens() {
        List<Token> tokens = tokens("\"%(a + (b))\"");

        assertEquals(List.of(INTERPOLATION, NAME, PLUS, LEFT_PAREN, NAME, RIGHT_PAREN, STRING, EOF),
            tokens.stream().map(Token::kind).collect(Collectors.toList()));
        assertEquals("\"%(", tokens.get(0).text());
        assertEquals("a", tokens.get(1).text());
        assertEquals("b", tokens.get(4).text());
        assertEquals(")\"", tokens.get(6).text());
    }

    @Test
    void testNestedInterpolation() {
        List<Token> tokens = tokens("\"a %(\"b %(c)\") d\"");

        assertEquals(List.of(INTERPOLATION, INTERPOLATION, NAME, STRING, STRING, EOF),
            tokens.stream().map(Token::kind).collect(Collectors.toList()));
        assertEquals("\"a %(", tokens.get(0).text());
        assertEquals("\"b %(", tokens.get(1).text());
        assertEquals(")\"", tokens.get(3).text());
        assertEquals(") d\"", tokens.get(4).text());
    }

    @Test
    void testPercentWithoutParenIsPlainText() {
        List<Token> tokens = tokens("\"50%\"");
        assertEquals(List.of(STRING, EOF), tokens.stream().map(Token::kind).collect(Collectors.toList()));
        assertEquals("\"50%\"", tokens.get(0).text());
    }

    @Test
    void testEscapesArePassedThrough() {
        List<Token> tokens = tokens("\"a\\\"b\" c");
        assertEquals(STRING, tokens.get(0).kind());
        assertEquals("\"a\\\"b\"", tokens.get(0).text());
        assertEquals(NAME, tokens.get(1).kind());
    }

    @Test
    void testKeywordsAndNames() {
        assertEquals(List.of(CLASS, NAME, IS, NAME, WHILE, NAME, EOF), kinds("class Foo is Bar while classy"));
        assertEquals(List.of(BREAK, CONSTRUCT, ELSE, FALSE, FOR, FOREIGN, IF, IMPORT, IN, NULL,
                             RETURN, STATIC, SUPER, THIS, TRUE, VAR, EOF),
            kinds("break construct else false for foreign if import in null return static super this true var"));
        assertTrue(WHILE.isKeyword());
        assertFalse(NAME.isKeyword());
        assertEquals(java.util.Optional.of(IMPORT), TokenKind.keyword("import"));
        assertEquals(java.util.Optional.empty(), TokenKind.keyword("classy"));
    }

    @Test
    void testFields() {
        List<Token> tokens = tokens("_name __count _");
        assertEquals(FIELD, tokens.get(0).kind());
        assertEquals("_name", tokens.get(0).text());
        assertEquals(STATIC_FIELD, tokens.get(1).kind());
        assertEquals("__count", tokens.get(1).text());
        assertEquals(FIELD, tokens.get(2).kind());
        assertEquals("_", tokens.get(2).text());
    }

    @Test
    void testNumbers() {
        List<Token> tokens = tokens("123 0x1F 0xg");
        assertEquals(NUMBER, tokens.get(0).kind());
        assertEquals("123", tokens.get(0).text());
        assertEquals(NUMBER, tokens.get(1).kind());
        assertEquals("0x1F", tokens.get(1).text());
        assertEquals(NUMBER, tokens.get(2).kind());
        assertEquals("0x", tokens.get(2).text());
        assertEquals(NAME, tokens.get(3).kind());

        // No fractional part: the dot is a token of its own.
        assertEquals(List.of(NUMBER, DOT, NUMBER, EOF), kinds("1.5"));
    }

    @Test
    void testNewlinesAreTokens() {
        assertEquals(List.of(NAME, LINE, NAME, EOF), kinds("a\r\nb"));
        assertEquals(List.of(LINE, LINE, EOF), kinds("\n\n"));
    }

    @Test
    void testLineCommentKeepsNewline() {
        assertEquals(List.of(NAME, LINE, NAME, EOF), kinds("a // comment\nb"));
        assertEquals(List.of(NAME, EOF), kinds("a // comment at end"));
    }

    @Test
    void testBlockCommentsNest() {
        assertEquals(List.of(NAME, NAME, EOF), kinds("a /* x /* y */ still comment */ b"));
        assertEquals(List.of(NAME, LINE, NAME, EOF), kinds("a /* spans\nlines */\nb"));
    }

    @Test
    void testUnterminatedLiteralsEndAtInput() {
        List<Token> tokens = tokens("\"abc");
        assertEquals(STRING, tokens.get(0).kind());
        assertEquals("\"abc", tokens.get(0).text());
        assertEquals(EOF, tokens.get(1).kind());

        assertEquals(List.of(NAME, EOF), kinds("a /* open /* */"));
    }

    @Test
    void testStrictLiteralsReportUnterminated() {
        List<Token> tokens = strictTokens("a /* open");
        assertEquals(ERROR, tokens.get(1).kind());
        assertEquals("/* open", tokens.get(1).text());
        assertEquals(EOF, tokens.get(2).kind());

        tokens = strictTokens("\"abc");
        assertEquals(ERROR, tokens.get(0).kind());
        assertEquals("\"abc", tokens.get(0).text());

        // Terminated literals are unaffected.
        assertEquals(STRING, strictTokens("\"abc\"").get(0).kind());
    }

    @Test
    void testUnknownCharacterIsError() {
        List<Token> tokens = tokens("a @ b");
        assertEquals(ERROR, tokens.get(1).kind());
        assertEquals("@", tokens.get(1).text());
        assertEquals(NAME, tokens.get(2).kind());
    }

    @Test
    void testEofIsRepeated() {
        Lexer lexer = new Lexer(new SourceBuffer("test.wren", "a  "));
        assertEquals(NAME, lexer.readToken().kind());
        for (int i = 0; i < 3; i++) {
            Token eof = lexer.readToken();
            assertEquals(EOF, eof.kind());
            assertEquals(3, eof.start());
            assertEquals(0, eof.length());
        }
    }

    @Test
    void testEmptyInput() {
        assertEquals(List.of(EOF), kinds(""));
        assertEquals(List.of(EOF), kinds("   \t"));
    }

    @Test
    void testTokenPositions() {
        List<Token> tokens = tokens("a\n  bc");
        Token bc = tokens.get(2);
        assertEquals("bc", bc.text());
        assertEquals(2, bc.line());
        assertEquals(3, bc.column());
        assertEquals(2, bc.endLine());
        assertEquals(5, bc.endColumn());
    }
}
