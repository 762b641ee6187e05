package com.tyron.nsedit.lang.newspeak.lexer;

import java.util.List;
import java.util.Objects;

/**
 * A movable buffer position that steps token by token.
 * Look-ahead and look-behind never move it.
 */
public final class TokenCursor {

    private final TokenScanner scanner;
    private int offset;

    public TokenCursor(TokenScanner scanner, int offset) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        moveTo(offset);
    }

    public int getOffset() {
        return offset;
    }

    public void moveTo(int offset) {
        int length = scanner.getBuffer().length();
        if (offset < 0 || offset > length) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + length);
        }
        this.offset = offset;
    }

    /**
     * @return The next token, without moving.
     */
    public Token peek() {
        return scanner.forwardToken(offset);
    }

    /**
     * Moves past the next token.
     */
    public Token advance() {
        Token token = scanner.forwardToken(offset);
        offset = token.end();
        return token;
    }

    /**
     * Moves before the previous token.
     */
    public Token retreat() {
        Token token = scanner.backwardToken(offset);
        offset = token.start();
        return token;
    }

    public List<Token> lookAhead(int count) {
        return scanner.scanAhead(offset, count);
    }

    public List<Token> lookBehind(int count) {
        return scanner.scanBehind(offset, count);
    }
}
