package com.tyron.nsedit.lang.newspeak.lexer;

/**
 * Semantic category of a Newspeak token.
 */
public enum TokenCategory {
    IDENTIFIER,
    /** A message selector part ending in one or two colons, e.g. {@code at:} or {@code x::}. */
    KEYWORD_OR_SETTER_SEND,
    MODIFIER,
    CLASS_NAME,
    CLASS,
    OPEN_PAREN,
    CLOSE_PAREN,
    OPEN_BLOCK,
    CLOSE_BLOCK,
    RETURN,
    PIPE,
    TYPE_HINT,
    /** A whole string literal, delimiters included. */
    STRING_DELIMITER,
    COMMENT,
    OTHER;

    public boolean isOpening() {
        return this == OPEN_PAREN || this == OPEN_BLOCK;
    }

    public boolean isClosing() {
        return this == CLOSE_PAREN || this == CLOSE_BLOCK;
    }
}
