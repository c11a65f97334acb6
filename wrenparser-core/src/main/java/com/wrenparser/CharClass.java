package com.wrenparser;

/**
 * Classification of single source characters. Only ASCII letters, digits and
 * underscore take part in identifiers and numbers.
 */
public final class CharClass {

    public static final char TAB = '\t';
    public static final char LINE_FEED = '\n';
    public static final char CARRIAGE_RETURN = '\r';
    public static final char SPACE = ' ';

    private CharClass() {
        // Utility class
    }

    /** Letters and underscore, the characters that may start a name. */
    public static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    public static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }

    public static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /** Whitespace the lexer discards. Line feeds are significant and are not included. */
    public static boolean isDiscardable(int c) {
        return c == SPACE || c == TAB || c == CARRIAGE_RETURN;
    }
}
