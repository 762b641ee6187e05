package com.tyron.nsedit.lang.newspeak.lexer;

import com.tyron.nsedit.lang.newspeak.text.SourceBuffer;
import com.tyron.nsedit.lang.newspeak.text.SyntaxRegion;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Finds the token after or before a buffer position.
 * <p>
 * Strings and comments come back whole. Forward scans return {@link Token#boundary} at the end of the
 * buffer and backward scans at offset 0, so every scanning loop terminates on any input.
 */
public final class TokenScanner {

    private final SourceBuffer buffer;

    public TokenScanner(SourceBuffer buffer) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    public SourceBuffer getBuffer() {
        return buffer;
    }

    /**
     * @return The next token at or after {@code offset}; continue scanning from {@link Token#end()}
     */
    public Token forwardToken(int offset) {
        checkOffset(offset);
        int length = buffer.length();

        SyntaxRegion enclosing = buffer.syntaxContextAt(offset);
        if (enclosing != null) {
            return enclosing.end() > offset ? regionToken(enclosing) : Token.boundary(length);
        }

        int pos = offset;
        while (pos < length && Character.isWhitespace(buffer.charAt(pos))) {
            pos++;
        }
        if (pos >= length) {
            return Token.boundary(length);
        }

        SyntaxRegion region = buffer.syntaxRegionAt(pos);
        if (region != null) {
            return regionToken(region);
        }

        char c = buffer.charAt(pos);
        if (isSingle(c)) {
            return token(pos, pos + 1);
        }
        if (c == '<') {
            int end = TypeHintMatcher.matchForward(buffer, pos);
            return token(pos, end > 0 ? end : pos + 1);
        }

        int end = pos + 1;
        if (TokenClassifier.isWordChar(c)) {
            while (end < length && TokenClassifier.isWordChar(buffer.charAt(end))) {
                end++;
            }
        } else {
            while (end < length && isOperatorChar(buffer.charAt(end))) {
                end++;
            }
        }
        return token(pos, end);
    }

    /**
     * @return The token before {@code offset}; continue scanning from {@link Token#start()}
     */
    public Token backwardToken(int offset) {
        checkOffset(offset);

        SyntaxRegion enclosing = buffer.syntaxContextAt(offset);
        if (enclosing != null) {
            return regionToken(enclosing);
        }

        int pos = offset;
        while (pos > 0 && Character.isWhitespace(buffer.charAt(pos - 1))) {
            pos--;
        }
        if (pos <= 0) {
            return Token.boundary(0);
        }

        SyntaxRegion region = buffer.syntaxRegionAt(pos - 1);
        if (region != null) {
            return regionToken(region);
        }

        char c = buffer.charAt(pos - 1);
        if (isSingle(c) || c == '<') {
            return token(pos - 1, pos);
        }
        if (c == '>') {
            int start = TypeHintMatcher.matchBackward(buffer, pos);
            if (start >= 0) {
                return token(start, pos);
            }
            if (pos >= 2 && buffer.charAt(pos - 2) == ']') {
                return token(pos - 1, pos);
            }
        }

        int start = pos - 1;
        if (TokenClassifier.isWordChar(c)) {
            while (start > 0 && TokenClassifier.isWordChar(buffer.charAt(start - 1))) {
                start--;
            }
        } else {
            while (start > 0 && isOperatorChar(buffer.charAt(start - 1))) {
                // a type hint's closing '>' belongs to the hint, as in "<Integer>="
                if (buffer.charAt(start - 1) == '>' && TypeHintMatcher.matchBackward(buffer, start) >= 0) {
                    break;
                }
                start--;
            }
        }
        return token(start, pos);
    }

    /**
     * @return Up to {@code count} tokens after {@code offset}, in scan order, without the boundary token
     */
    public List<Token> scanAhead(int offset, int count) {
        List<Token> result = new ArrayList<>(Math.max(0, count));
        Iterator<Token> it = tokensAfter(offset).iterator();
        while (result.size() < count && it.hasNext()) {
            result.add(it.next());
        }
        return result;
    }

    /**
     * @return Up to {@code count} tokens before {@code offset}, nearest first, without the boundary token
     */
    public List<Token> scanBehind(int offset, int count) {
        List<Token> result = new ArrayList<>(Math.max(0, count));
        Iterator<Token> it = tokensBefore(offset).iterator();
        while (result.size() < count && it.hasNext()) {
            result.add(it.next());
        }
        return result;
    }

    /**
     * Lazily scans forward from {@code offset}, comments included.
     */
    public Iterable<Token> tokensAfter(int offset) {
        checkOffset(offset);
        return () -> new TokenIterator(offset, true, false);
    }

    /**
     * Lazily scans backward from {@code offset}, nearest token first, comments included.
     */
    public Iterable<Token> tokensBefore(int offset) {
        checkOffset(offset);
        return () -> new TokenIterator(offset, false, false);
    }

    /**
     * Like {@link #tokensAfter(int)} but skips comments.
     */
    public Iterable<Token> significantTokensAfter(int offset) {
        checkOffset(offset);
        return () -> new TokenIterator(offset, true, true);
    }

    /**
     * Like {@link #tokensBefore(int)} but skips comments.
     */
    public Iterable<Token> significantTokensBefore(int offset) {
        checkOffset(offset);
        return () -> new TokenIterator(offset, false, true);
    }

    private Token regionToken(SyntaxRegion region) {
        return token(region.start(), region.end());
    }

    private Token token(int start, int end) {
        String text = buffer.slice(start, end);
        return new Token(text, TokenClassifier.classify(text), start, end);
    }

    private void checkOffset(int offset) {
        if (offset < 0 || offset > buffer.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + buffer.length());
        }
    }

    private static boolean isSingle(char c) {
        switch (c) {
            case '(': case ')': case '[': case ']': case '{': case '}': case '|': case '^':
                return true;
            default:
                return false;
        }
    }

    private static boolean isOperatorChar(char c) {
        return !Character.isWhitespace(c)
                && !TokenClassifier.isWordChar(c)
                && !isSingle(c)
                && c != '<' && c != '\'' && c != '"';
    }

    private final class TokenIterator implements Iterator<Token> {

        private final boolean forward;
        private final boolean skipComments;
        private int position;
        private Token next;
        private boolean done;

        TokenIterator(int position, boolean forward, boolean skipComments) {
            this.position = position;
            this.forward = forward;
            this.skipComments = skipComments;
        }

        @Override
        public boolean hasNext() {
            while (next == null && !done) {
                Token token = forward ? forwardToken(position) : backwardToken(position);
                int newPosition = forward ? token.end() : token.start();
                boolean progressed = forward ? newPosition > position : newPosition < position;
                if (token.isBoundary() || !progressed) {
                    done = true;
                    break;
                }
                position = newPosition;
                if (!(skipComments && token.is(TokenCategory.COMMENT))) {
                    next = token;
                }
            }
            return next != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token result = next;
            next = null;
            return result;
        }
    }
}
