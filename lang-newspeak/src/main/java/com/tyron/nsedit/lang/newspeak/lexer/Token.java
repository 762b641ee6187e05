package com.tyron.nsedit.lang.newspeak.lexer;

import java.util.Objects;

/**
 * A classified span of source text, [start, end).
 * <p>
 * The boundary token has empty text and marks the start or end of the buffer.
 */
public record Token(String text, TokenCategory category, int start, int end) {

    public Token {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(category, "category");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("bad token range [" + start + ", " + end + ")");
        }
    }

    public static Token boundary(int offset) {
        return new Token("", TokenCategory.OTHER, offset, offset);
    }

    public boolean isBoundary() {
        return text.isEmpty();
    }

    public boolean is(TokenCategory category) {
        return this.category == category;
    }

    public int length() {
        return end - start;
    }
}
