package com.wrenparser;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class TestSourceBuffer {

    @Test
    void testLineAndColumn() {
        SourceBuffer source = new SourceBuffer("test.wren", "ab\ncd\n");

        assertEquals(1, source.lineAt(0));
        assertEquals(1, source.columnAt(0));
        // The line feed belongs to the line it ends.
        assertEquals(1, source.lineAt(2));
        assertEquals(3, source.columnAt(2));
        assertEquals(2, source.lineAt(3));
        assertEquals(1, source.columnAt(3));
        assertEquals(2, source.lineAt(5));
        assertEquals(3, source.columnAt(5));
        // End of file sits on the empty line after the last line feed.
        assertEquals(3, source.lineAt(6));
        assertEquals(1, source.columnAt(6));
        assertEquals(3, source.lineCount());
    }

    @Test
    void testEveryOffsetRoundTrips() {
        String text = "class Foo {\n  bar() { 1 }\n\n}\nlast";
        SourceBuffer source = new SourceBuffer("test.wren", text);

        for (int offset = 0; offset <= text.length(); offset++) {
            int line = source.lineAt(offset);
            int lineStart = source.lineStart(line);
            assertEquals(1, source.columnAt(lineStart), "column at start of line " + line);
            assertEquals(offset, lineStart + source.columnAt(offset) - 1, "offset " + offset);
        }
    }

    @Test
    void testEmptySource() {
        SourceBuffer source = new SourceBuffer("empty.wren", "");
        assertEquals(0, source.length());
        assertEquals(1, source.lineAt(0));
        assertEquals(1, source.columnAt(0));
        assertEquals("", source.lineText(1));
    }

    @Test
    void testLineText() {
        SourceBuffer source = new SourceBuffer("test.wren", "first\nsecond\n");
        assertEquals("first", source.lineText(1));
        assertEquals("second", source.lineText(2));
        assertEquals("", source.lineText(3));
        assertThrows(IndexOutOfBoundsException.class, () -> source.lineText(4));
        assertThrows(IndexOutOfBoundsException.class, () -> source.lineText(0));
    }

    @Test
    void testSubstringAndIndex() {
        SourceBuffer source = new SourceBuffer("test.wren", "ab\ncd");
        assertEquals("cd", source.substring(3, 2));
        assertEquals("", source.substring(5, 0));
        assertEquals('c', source.index(3));
    }

    @Test
    void testOutOfRangeOffsetsAreRejected() {
        SourceBuffer source = new SourceBuffer("test.wren", "abc");
        assertThrows(IndexOutOfBoundsException.class, () -> source.index(3));
        assertThrows(IndexOutOfBoundsException.class, () -> source.lineAt(4));
        assertThrows(IndexOutOfBoundsException.class, () -> source.lineAt(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> source.columnAt(4));
        assertThrows(IndexOutOfBoundsException.class, () -> source.substring(2, 2));
    }

    @Test
    void testFromBytesDecodesUtf8() {
        byte[] bytes = "var s = \"hé\"".getBytes(StandardCharsets.UTF_8);
        SourceBuffer source = SourceBuffer.fromBytes("utf8.wren", bytes);
        assertEquals("utf8.wren", source.id());
        assertEquals("var s = \"hé\"", source.substring(0, source.length()));
    }
}
