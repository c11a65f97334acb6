package com.wrenparser;

import java.util.Objects;

/**
 * A span of source text tagged with its kind.
 *
 * <p>The token refers back to the {@link SourceBuffer} it was read from and
 * extracts its text and position on demand. It must not be kept longer than
 * the buffer is meant to live.</p>
 */
public record Token(TokenKind kind, int start, int length, SourceBuffer source) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.checkFromIndexSize(start, length, source.length());
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    /** Offset just past the last character. */
    public int end() {
        return start + length;
    }

    public String text() {
        return source.substring(start, length);
    }

    /** The 1-based line the token starts on. */
    public int line() {
        return source.lineAt(start);
    }

    /** The 1-based column the token starts at. */
    public int column() {
        return source.columnAt(start);
    }

    public int endLine() {
        return source.lineAt(end());
    }

    public int endColumn() {
        return source.columnAt(end());
    }

    @Override
    public String toString() {
        return text();
    }
}
