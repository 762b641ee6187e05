package com.tyron.nsedit.lang.newspeak.indent;

import com.tyron.nsedit.lang.newspeak.lexer.Token;
import com.tyron.nsedit.lang.newspeak.lexer.TokenCategory;
import com.tyron.nsedit.lang.newspeak.lexer.TokenScanner;
import com.tyron.nsedit.lang.newspeak.text.SourceBuffer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Questions about the syntactic surroundings of a position, answered by scanning tokens
 * outward from it. Comments are skipped by every probe.
 * <p>
 * "Unmatched" brackets are found by skipping balanced {@code (...)} and {@code [...]} groups;
 * a closer of either kind cancels the next opener of either kind, so unbalanced text still
 * yields an answer.
 */
public final class ContextProbes {

    private final SourceBuffer buffer;
    private final TokenScanner scanner;

    public ContextProbes(SourceBuffer buffer) {
        this(new TokenScanner(buffer));
    }

    public ContextProbes(TokenScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.buffer = scanner.getBuffer();
    }

    public SourceBuffer getBuffer() {
        return buffer;
    }

    public TokenScanner getScanner() {
        return scanner;
    }

    /**
     * @return true if the nearest unbalanced boundary before {@code offset} is a pipe rather than an
     * open parenthesis or the start of the buffer
     */
    public boolean withinSlots(int offset) {
        Token boundary = findUnmatchedBefore(offset,
                t -> t.is(TokenCategory.PIPE) || t.is(TokenCategory.OPEN_PAREN));
        return boundary.is(TokenCategory.PIPE);
    }

    /**
     * @return true if the nearest unbalanced boundary before {@code offset} is an open block, or the
     * pipe that ends a block's parameters or temporaries
     */
    public boolean withinBlock(int offset) {
        Token boundary = findUnmatchedBefore(offset,
                t -> t.is(TokenCategory.OPEN_BLOCK) || t.is(TokenCategory.PIPE) || t.is(TokenCategory.OPEN_PAREN));
        if (boundary.is(TokenCategory.OPEN_BLOCK)) {
            return true;
        }
        return boundary.is(TokenCategory.PIPE) && isBlockHeaderPipe(boundary);
    }

    /**
     * @return true if the nearest unmatched {@code [} before the line is on the line right above it
     */
    public boolean firstLineInBlock(int line) {
        Token open = enclosingBlock(buffer.getLineStartOffset(line));
        return !open.isBoundary() && buffer.getLineNumber(open.start()) == line - 1;
    }

    /**
     * @return true if the nearest unmatched {@code ]} after the start of the line is on that line
     */
    public boolean closingBlock(int line) {
        int lineEnd = buffer.getLineEndOffset(line);
        int depth = 0;
        for (Token token : scanner.significantTokensAfter(buffer.getLineStartOffset(line))) {
            if (token.start() > lineEnd) {
                return false;
            }
            TokenCategory category = token.category();
            if (category.isOpening()) {
                depth++;
            } else if (category.isClosing()) {
                if (depth > 0) {
                    depth--;
                } else if (category == TokenCategory.CLOSE_BLOCK) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * @return Indentation of the line holding the nearest token before {@code offset} that matches,
     * or -1 if there is none
     */
    public int columnOfToken(int offset, Predicate<Token> pattern) {
        for (Token token : scanner.significantTokensBefore(offset)) {
            if (pattern.test(token)) {
                return buffer.getIndentation(buffer.getLineNumber(token.start()));
            }
        }
        return -1;
    }

    /**
     * @return Indentation of the line holding the nearest unmatched {@code [} before {@code offset},
     * or -1 if there is none
     */
    public int columnOfEnclosingBlock(int offset) {
        Token open = enclosingBlock(offset);
        return open.isBoundary() ? -1 : buffer.getIndentation(buffer.getLineNumber(open.start()));
    }

    /**
     * @return Number of unmatched {@code (} and {@code [} before {@code offset}
     */
    public int nestingDepth(int offset) {
        int depth = 0;
        for (Token token : scanner.significantTokensAfter(0)) {
            if (token.start() >= offset) {
                break;
            }
            if (token.category().isOpening()) {
                depth++;
            } else if (token.category().isClosing() && depth > 0) {
                depth--;
            }
        }
        return depth;
    }

    public boolean isModifierLine(int line) {
        return firstTokenIs(line, TokenCategory.MODIFIER);
    }

    public boolean isClosingParenLine(int line) {
        return firstTokenIs(line, TokenCategory.CLOSE_PAREN);
    }

    public boolean isPipeLine(int line) {
        return firstTokenIs(line, TokenCategory.PIPE);
    }

    /**
     * @return true if the line starts with {@code class Name}, optionally after an access modifier
     */
    public boolean isClassLine(int line) {
        int lineEnd = buffer.getLineEndOffset(line);
        List<Token> tokens = significantAhead(buffer.getLineStartOffset(line), 3);
        if (tokens.isEmpty() || tokens.get(0).start() > lineEnd) {
            return false;
        }

        int i = tokens.get(0).is(TokenCategory.MODIFIER) ? 1 : 0;
        if (i >= tokens.size() || !tokens.get(i).is(TokenCategory.CLASS)) {
            return false;
        }
        // "class" as the last word of the buffer is a declaration being typed
        return i + 1 >= tokens.size() || tokens.get(i + 1).is(TokenCategory.CLASS_NAME);
    }

    public boolean inComment(int offset) {
        return buffer.inComment(offset);
    }

    public boolean inString(int offset) {
        return buffer.inString(offset);
    }

    private boolean firstTokenIs(int line, TokenCategory category) {
        List<Token> tokens = significantAhead(buffer.getLineStartOffset(line), 1);
        return !tokens.isEmpty()
                && tokens.get(0).start() <= buffer.getLineEndOffset(line)
                && tokens.get(0).is(category);
    }

    private List<Token> significantAhead(int offset, int count) {
        List<Token> result = new ArrayList<>(count);
        Iterator<Token> it = scanner.significantTokensAfter(offset).iterator();
        while (result.size() < count && it.hasNext()) {
            result.add(it.next());
        }
        return result;
    }

    private Token enclosingBlock(int offset) {
        return findUnmatchedBefore(offset, t -> t.is(TokenCategory.OPEN_BLOCK));
    }

    /**
     * Scans backward, skipping balanced groups, until a token at the outer level satisfies {@code stop}.
     *
     * @return The matching token, or the boundary token at offset 0
     */
    private Token findUnmatchedBefore(int offset, Predicate<Token> stop) {
        int pending = 0;
        for (Token token : scanner.significantTokensBefore(offset)) {
            TokenCategory category = token.category();
            if (category.isClosing()) {
                pending++;
                continue;
            }
            if (category.isOpening() && pending > 0) {
                pending--;
                continue;
            }
            if (pending == 0 && stop.test(token)) {
                return token;
            }
        }
        return Token.boundary(0);
    }

    /**
     * A pipe closes a block header when only block parameters ({@code :x}) and temporaries separate it
     * from an open block: {@code [:a :b |}, {@code [ | t |} or {@code [:a | | t |}.
     */
    private boolean isBlockHeaderPipe(Token pipe) {
        Iterator<Token> it = scanner.significantTokensBefore(pipe.start()).iterator();
        int pipesSeen = 1;
        while (it.hasNext()) {
            Token token = it.next();
            if (token.is(TokenCategory.OPEN_BLOCK)) {
                return true;
            }
            if (token.is(TokenCategory.PIPE)) {
                if (++pipesSeen > 3) {
                    return false;
                }
                continue;
            }
            if (!token.is(TokenCategory.IDENTIFIER)) {
                return false;
            }
        }
        return false;
    }
}
