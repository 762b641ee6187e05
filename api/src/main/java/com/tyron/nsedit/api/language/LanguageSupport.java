package com.tyron.nsedit.api.language;

import com.tyron.nsedit.api.editor.Indenter;
import com.tyron.nsedit.api.editor.SyntaxHighlighter;
import com.tyron.nsedit.api.settings.Configuration;
import org.jetbrains.annotations.NotNull;

/**
 * Factory interface for language services.
 */
public interface LanguageSupport {

    /**
     * @return Stable language id (e.g. "newspeak"), also used as the options namespace.
     */
    @NotNull String getId();

    /**
     * @return true if this support handles the given file (e.g. endsWith(".ns"))
     */
    boolean canHandle(@NotNull String fileName);

    /**
     * Creates a highlighter for files of this language.
     */
    SyntaxHighlighter createHighlighter();

    /**
     * Creates a line indenter configured from the given configuration.
     *
     * Returning {@code null} means indentation is not supported for this language.
     */
    default Indenter createIndenter(@NotNull Configuration configuration) {
        return null;
    }
}
