package com.tyron.nsedit.api.editor;

import org.jetbrains.annotations.NotNull;

/**
 * Decides the indentation of a single line.
 * <p>
 * Implementations must not keep state between calls: every call sees the document as it is now.
 */
public interface Indenter {

    /**
     * @param line zero-based line index
     * @return The target indentation column (always {@code >= 0}).
     * @throws IndexOutOfBoundsException if the line does not exist in the document
     */
    int computeIndent(@NotNull Document document, int line);
}
