package com.tyron.nsedit.api.editor;

/**
 * A data object representing a range of text to style.
 */
public record TokenSpan(int start, int length, TokenType type) {

    public TokenSpan {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("negative span start=" + start + " length=" + length);
        }
    }

    public int end() {
        return start + length;
    }

    public enum TokenType {
        KEYWORD, TYPE, STRING, COMMENT, METHOD
    }
}
