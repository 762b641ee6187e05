package com.tyron.nsedit.api.editor;

/**
 * Abstract view of the text content.
 * <p>
 * Lines are zero-based; a line's end offset excludes its terminating newline.
 */
public interface Document {
    String getText();
    int getTextLength();

    /**
     * Replaces text in the range [start, end).
     */
    void replace(int start, int end, String text);

    void insertString(int offset, String text);

    void deleteString(int start, int end);

    /**
     * @return The text in the given range.
     */
    String getText(int start, int length);

    /**
     * @return Number of lines; an empty document has one line.
     */
    int getLineCount();

    int getLineStartOffset(int line);

    int getLineEndOffset(int line);

    /**
     * @return The line containing {@code offset}; {@code getTextLength()} maps to the last line.
     */
    int getLineNumber(int offset);
}
