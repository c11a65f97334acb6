package com.wrenparser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

import static com.wrenparser.TokenKind.*;

/**
 * Turns a {@link SourceBuffer} into tokens, one at a time on demand.
 *
 * <p>A lexer is single-use and not thread-safe. Once the end of input is
 * reached every further call to {@link #readToken()} returns an {@code eof}
 * token.</p>
 */
public final class Lexer {

    /**
     * One step of a maximal-munch chain: the token kind produced so far and,
     * if {@code longer} is present, the character that extends it.
     */
    private record Punctuator(TokenKind kind, char next, Punctuator longer) {
        Punctuator(TokenKind kind) {
            this(kind, '\0', null);
        }
    }

    private static final Map<Character, Punctuator> PUNCTUATORS = Map.ofEntries(
        Map.entry('(', new Punctuator(LEFT_PAREN)),
        Map.entry(')', new Punctuator(RIGHT_PAREN)),
        Map.entry('[', new Punctuator(LEFT_BRACKET)),
        Map.entry(']', new Punctuator(RIGHT_BRACKET)),
        Map.entry('{', new Punctuator(LEFT_BRACE)),
        Map.entry('}', new Punctuator(RIGHT_BRACE)),
        Map.entry(':', new Punctuator(COLON)),
        Map.entry(',', new Punctuator(COMMA)),
        Map.entry('*', new Punctuator(STAR)),
        Map.entry('/', new Punctuator(SLASH)),
        Map.entry('%', new Punctuator(PERCENT)),
        Map.entry('+', new Punctuator(PLUS)),
        Map.entry('-', new Punctuator(MINUS)),
        Map.entry('~', new Punctuator(TILDE)),
        Map.entry('^', new Punctuator(CARET)),
        Map.entry('?', new Punctuator(QUESTION)),
        Map.entry(CharClass.LINE_FEED, new Punctuator(LINE)),
        Map.entry('|', new Punctuator(PIPE, '|', new Punctuator(PIPE_PIPE))),
        Map.entry('&', new Punctuator(AMP, '&', new Punctuator(AMP_AMP))),
        Map.entry('!', new Punctuator(BANG, '=', new Punctuator(BANG_EQUAL))),
        Map.entry('=', new Punctuator(EQUAL, '=', new Punctuator(EQUAL_EQUAL))),
        Map.entry('.', new Punctuator(DOT, '.', new Punctuator(DOT_DOT, '.', new Punctuator(DOT_DOT_DOT))))
    );

    private final SourceBuffer source;
    private final boolean strictLiterals;

    private int start = 0;
    private int current = 0;

    // One entry per open string interpolation: the number of '(' still unmatched inside it
    private int[] interpolations = new int[4];
    private int interpolationDepth = 0;

    public Lexer(SourceBuffer source) {
        this(source, false);
    }

    /**
     * @param strictLiterals when {@code true}, a string or block comment still
     *                       open at end of input becomes an {@code error} token
     *                       instead of ending silently
     */
    public Lexer(SourceBuffer source, boolean strictLiterals) {
        this.source = source;
        this.strictLiterals = strictLiterals;
    }

    /**
     * Reads every remaining token, up to and including the first {@code eof}.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = readToken();
            tokens.add(token);
        } while (!token.is(EOF));
        return tokens;
    }

    public Token readToken() {
        if (isAtEnd()) {
            return makeEof();
        }

        int unterminatedComment = skipWhitespace();
        if (unterminatedComment >= 0 && strictLiterals) {
            start = unterminatedComment;
            return makeToken(ERROR);
        }
        if (isAtEnd()) {
            return makeEof();
        }

        start = current;
        char c = advance();

        if (interpolationDepth > 0) {
            int top = interpolationDepth - 1;
            if (c == '(') {
                interpolations[top]++;
            } else if (c == ')') {
                interpolations[top]--;

                // The ")" that balances the opening "%(" resumes the string.
                if (interpolations[top] == 0) {
                    interpolationDepth--;
                    return readString();
                }
            }
        }

        Punctuator punctuator = PUNCTUATORS.get(c);
        if (punctuator != null) {
            while (punctuator.longer() != null && matchChar(punctuator.next())) {
                punctuator = punctuator.longer();
            }
            return makeToken(punctuator.kind());
        }

        switch (c) {
            case '<':
                if (matchChar('<')) return makeToken(LESS_LESS);
                if (matchChar('=')) return makeToken(LESS_EQUAL);
                return makeToken(LESS);
            case '>':
                if (matchChar('>')) return makeToken(GREATER_GREATER);
                if (matchChar('=')) return makeToken(GREATER_EQUAL);
                return makeToken(GREATER);
            case '_':
                return readField();
            case '"':
                return readString();
            default:
                break;
        }

        if (c == '0' && peek() == 'x') return readHexNumber();
        if (CharClass.isDigit(c)) return readNumber();
        if (CharClass.isAlpha(c)) return readName();

        return makeToken(ERROR);
    }

    /**
     * Skips whitespace and comments. Returns the offset of a block comment left
     * open at end of input, or -1.
     */
    private int skipWhitespace() {
        while (true) {
            int c = peek();
            if (CharClass.isDiscardable(c)) {
                advance();
            } else if (c == '/' && peek(1) == '/') {
                // Stops before the newline, which is a token of its own.
                while (peek() != CharClass.LINE_FEED && !isAtEnd()) {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                int commentStart = current;
                if (!skipBlockComment()) {
                    return commentStart;
                }
            } else {
                return -1;
            }
        }
    }

    // Block comments nest. Returns false if input ends first.
    private boolean skipBlockComment() {
        current += 2;
        int nesting = 1;
        while (nesting > 0) {
            if (isAtEnd()) {
                return false;
            }

            if (peek() == '/' && peek(1) == '*') {
                current += 2;
                nesting++;
            } else if (peek() == '*' && peek(1) == '/') {
                current += 2;
                nesting--;
            } else {
                advance();
            }
        }
        return true;
    }

    // Reads an instance field, or a static field when the name starts with "__".
    private Token readField() {
        TokenKind kind = FIELD;
        if (matchChar('_')) {
            kind = STATIC_FIELD;
        }

        while (matchWhere(CharClass::isAlphaNumeric)) {
            // Consume the rest of the name.
        }
        return makeToken(kind);
    }

    // Reads a string literal, or the next segment of one after an interpolated expression.
    private Token readString() {
        while (!isAtEnd()) {
            char c = advance();

            if (c == '\\') {
                // Escapes are passed through unchecked.
                if (!isAtEnd()) {
                    advance();
                }
            } else if (c == '%' && matchChar('(')) {
                pushInterpolation();
                return makeToken(INTERPOLATION);
            } else if (c == '"') {
                return makeToken(STRING);
            }
        }

        return makeToken(strictLiterals ? ERROR : STRING);
    }

    private void pushInterpolation() {
        if (interpolationDepth == interpolations.length) {
            interpolations = Arrays.copyOf(interpolations, interpolationDepth * 2);
        }
        // Counts the "(" already consumed after the "%".
        interpolations[interpolationDepth++] = 1;
    }

    private Token readHexNumber() {
        // Skip past the "x".
        advance();

        while (matchWhere(CharClass::isHexDigit)) {
            // Consume hex digits.
        }
        return makeToken(NUMBER);
    }

    private Token readNumber() {
        while (matchWhere(CharClass::isDigit)) {
            // Consume digits.
        }
        return makeToken(NUMBER);
    }

    private Token readName() {
        while (matchWhere(CharClass::isAlphaNumeric)) {
            // Consume the rest of the name.
        }

        String text = source.substring(start, current - start);
        return makeToken(TokenKind.keyword(text).orElse(NAME));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.index(current++);
    }

    private int peek() {
        return peek(0);
    }

    // The character n places ahead, or -1 past the end.
    private int peek(int n) {
        if (current + n >= source.length()) {
            return -1;
        }
        return source.index(current + n);
    }

    /**
     * Consumes the current character if it is {@code expected}.
     */
    private boolean matchChar(char expected) {
        if (isAtEnd() || source.index(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    /**
     * Consumes the current character if it satisfies {@code condition}.
     */
    private boolean matchWhere(IntPredicate condition) {
        if (isAtEnd() || !condition.test(source.index(current))) {
            return false;
        }
        current++;
        return true;
    }

    private Token makeToken(TokenKind kind) {
        return new Token(kind, start, current - start, source);
    }

    private Token makeEof() {
        start = source.length();
        current = source.length();
        return new Token(EOF, start, 0, source);
    }
}
