package com.wrenparser;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable source text plus the offsets at which each line starts.
 *
 * <p>Offsets count UTF-16 code units of the decoded text. Every offset in
 * {@code [0, length()]} belongs to exactly one line, including {@code length()}
 * itself, which is the end-of-file position.</p>
 *
 * <p>A buffer may be read by any number of lexers at once.</p>
 */
public final class SourceBuffer {

    private final String id;
    private final String text;
    // Starting offset of each line; lineStarts[0] == 0, strictly increasing
    private final int[] lineStarts;

    public SourceBuffer(String id, String text) {
        this.id = Objects.requireNonNull(id, "id");
        this.text = Objects.requireNonNull(text, "text");
        this.lineStarts = computeLineStarts(text);
    }

    /**
     * Decodes UTF-8 bytes supplied by the host that loaded the file.
     */
    public static SourceBuffer fromBytes(String id, byte[] bytes) {
        return new SourceBuffer(id, new String(bytes, StandardCharsets.UTF_8));
    }

    private static int[] computeLineStarts(String text) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == CharClass.LINE_FEED) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    /** The path or other identifier the host gave this source. */
    public String id() {
        return id;
    }

    /** The character at {@code offset}. */
    public char index(int offset) {
        return text.charAt(Objects.checkIndex(offset, text.length()));
    }

    public int length() {
        return text.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Gets the 1-based line that the character at {@code offset} lies on.
     */
    public int lineAt(int offset) {
        checkOffset(offset);
        int low = 0;
        int high = lineStarts.length - 1;
        // Greatest i with lineStarts[i] <= offset
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /**
     * Gets the 1-based column of {@code offset} within its line.
     */
    public int columnAt(int offset) {
        return offset - lineStarts[lineAt(offset) - 1] + 1;
    }

    /** The offset at which the 1-based {@code line} starts. */
    public int lineStart(int line) {
        Objects.checkIndex(line - 1, lineStarts.length);
        return lineStarts[line - 1];
    }

    /**
     * Gets the text of the 1-based {@code line}, without its line feed.
     */
    public String lineText(int line) {
        int start = lineStart(line);
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        return text.substring(start, end);
    }

    /**
     * Gets {@code length} characters starting at {@code start}.
     */
    public String substring(int start, int length) {
        Objects.checkFromIndexSize(start, length, text.length());
        return text.substring(start, start + length);
    }

    private void checkOffset(int offset) {
        // length() itself is a valid position
        Objects.checkIndex(offset, text.length() + 1);
    }

    @Override
    public String toString() {
        return "SourceBuffer[" + id + ", " + text.length() + " chars]";
    }
}
