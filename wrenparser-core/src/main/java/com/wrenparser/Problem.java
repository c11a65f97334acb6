package com.wrenparser;

/**
 * A syntax problem found while parsing, attached to the token it was reported at.
 */
public record Problem(String message, Token token) {

    public int line() {
        return token.line();
    }

    public int column() {
        return token.column();
    }

    @Override
    public String toString() {
        return token.source().id() + ":" + line() + ":" + column() + ": " + message;
    }
}
