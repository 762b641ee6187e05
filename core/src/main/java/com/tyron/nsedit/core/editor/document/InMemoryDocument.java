package com.tyron.nsedit.core.editor.document;

import com.tyron.nsedit.api.editor.Document;

import java.util.Objects;

/**
 * Simple in-memory {@link Document} implementation.
 *
 * The line table is rebuilt lazily after the first line query following an edit.
 *
 * Thread-safety: all text operations are synchronized on an internal lock.
 */
public final class InMemoryDocument implements Document {

    private final Object lock = new Object();
    private final StringBuilder text;

    private long modificationStamp;
    private LineIndex lineIndex;

    public InMemoryDocument(String initialText) {
        this.text = new StringBuilder(initialText != null ? initialText : "");
    }

    @Override
    public String getText() {
        synchronized (lock) {
            return text.toString();
        }
    }

    @Override
    public int getTextLength() {
        synchronized (lock) {
            return text.length();
        }
    }

    @Override
    public void replace(int start, int end, String newText) {
        Objects.requireNonNull(newText, "text");

        synchronized (lock) {
            int len = text.length();
            if (start < 0 || end < start || end > len) {
                throw new IndexOutOfBoundsException("replace range [" + start + ", " + end + ") is out of bounds for length=" + len);
            }

            text.replace(start, end, newText);
            modificationStamp++;
            lineIndex = null;
        }
    }

    @Override
    public void insertString(int offset, String insertedText) {
        replace(offset, offset, insertedText);
    }

    @Override
    public void deleteString(int start, int end) {
        replace(start, end, "");
    }

    @Override
    public String getText(int start, int length) {
        synchronized (lock) {
            int len = text.length();
            if (start < 0 || length < 0 || start + length > len) {
                throw new IndexOutOfBoundsException("getText start=" + start + " length=" + length + " is out of bounds for length=" + len);
            }
            return text.substring(start, start + length);
        }
    }

    @Override
    public int getLineCount() {
        return lines().getLineCount();
    }

    @Override
    public int getLineStartOffset(int line) {
        return lines().getLineStartOffset(line);
    }

    @Override
    public int getLineEndOffset(int line) {
        return lines().getLineEndOffset(line);
    }

    @Override
    public int getLineNumber(int offset) {
        return lines().getLineNumber(offset);
    }

    /**
     * Monotonically increasing stamp; increments on every change.
     */
    public long getModificationStamp() {
        synchronized (lock) {
            return modificationStamp;
        }
    }

    private LineIndex lines() {
        synchronized (lock) {
            if (lineIndex == null) {
                lineIndex = LineIndex.of(text);
            }
            return lineIndex;
        }
    }
}
