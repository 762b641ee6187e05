package com.tyron.nsedit.core.editor.document;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable table of line start offsets for a piece of text.
 *
 * Only {@code '\n'} terminates a line; a trailing {@code '\r'} is reported as part of the line.
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int textLength;

    private LineIndex(int[] lineStarts, int textLength) {
        this.lineStarts = lineStarts;
        this.textLength = textLength;
    }

    public static LineIndex of(CharSequence text) {
        Objects.requireNonNull(text, "text");
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return new LineIndex(Arrays.copyOf(starts, count), text.length());
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    public int getTextLength() {
        return textLength;
    }

    public int getLineStartOffset(int line) {
        checkLine(line);
        return lineStarts[line];
    }

    public int getLineEndOffset(int line) {
        checkLine(line);
        return line + 1 < lineStarts.length ? lineStarts[line + 1] - 1 : textLength;
    }

    public int getLineNumber(int offset) {
        if (offset < 0 || offset > textLength) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + textLength);
        }
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    private void checkLine(int line) {
        if (line < 0 || line >= lineStarts.length) {
            throw new IndexOutOfBoundsException("line " + line + " is out of bounds for lineCount=" + lineStarts.length);
        }
    }
}
