package com.tyron.nsedit.lang.newspeak.text;

import org.jetbrains.annotations.Nullable;

/**
 * Immutable, line-addressable view of source text with syntactic-context queries.
 * Lines are zero-based.
 */
public interface SourceBuffer extends CharSequence {

    String slice(int start, int end);

    /**
     * @return The string or comment whose text (delimiters included) covers the character at {@code offset}
     */
    @Nullable SyntaxRegion syntaxRegionAt(int offset);

    /**
     * @return The string or comment that the position {@code offset} is inside of, or null in code
     */
    @Nullable SyntaxRegion syntaxContextAt(int offset);

    default boolean inString(int offset) {
        SyntaxRegion region = syntaxContextAt(offset);
        return region != null && region.kind() == SyntaxRegion.Kind.STRING;
    }

    default boolean inComment(int offset) {
        SyntaxRegion region = syntaxContextAt(offset);
        return region != null && region.kind() == SyntaxRegion.Kind.COMMENT;
    }

    int getLineCount();

    int getLineStartOffset(int line);

    int getLineEndOffset(int line);

    int getLineNumber(int offset);

    /**
     * @return Offset of the first non-blank character of the line, or its end offset if the line is blank.
     */
    int getFirstNonBlankOffset(int line);

    /**
     * @return Indentation column of the line (tabs expanded).
     */
    int getIndentation(int line);
}
