package com.tyron.nsedit.lang.newspeak.text;

/**
 * Extent of a string literal or comment, delimiters included: [start, end).
 * An unterminated region runs to the end of the buffer.
 */
public record SyntaxRegion(Kind kind, int start, int end, boolean terminated) {

    public enum Kind {
        STRING, COMMENT
    }

    public boolean covers(int offset) {
        return offset >= start && offset < end;
    }

    /**
     * @return true if {@code offset} lies after the opening delimiter and before the region is closed
     */
    public boolean encloses(int offset) {
        return offset > start && (offset < end || (!terminated && offset == end));
    }
}
