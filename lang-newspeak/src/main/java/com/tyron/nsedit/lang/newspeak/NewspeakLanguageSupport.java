package com.tyron.nsedit.lang.newspeak;

import com.tyron.nsedit.api.editor.Indenter;
import com.tyron.nsedit.api.editor.SyntaxHighlighter;
import com.tyron.nsedit.api.language.LanguageSupport;
import com.tyron.nsedit.api.settings.Configuration;
import com.tyron.nsedit.api.settings.LanguageOptions;
import com.tyron.nsedit.lang.newspeak.editor.NewspeakSyntaxHighlighter;
import com.tyron.nsedit.lang.newspeak.indent.IndentOptions;
import com.tyron.nsedit.lang.newspeak.indent.NewspeakIndenter;
import org.jetbrains.annotations.NotNull;

public class NewspeakLanguageSupport implements LanguageSupport {

    public static final String ID = "newspeak";
    public static final String FILE_EXTENSION = ".ns";

    @Override
    public @NotNull String getId() {
        return ID;
    }

    @Override
    public boolean canHandle(@NotNull String fileName) {
        return fileName.endsWith(FILE_EXTENSION);
    }

    @Override
    public SyntaxHighlighter createHighlighter() {
        return new NewspeakSyntaxHighlighter();
    }

    @Override
    public Indenter createIndenter(@NotNull Configuration configuration) {
        return new NewspeakIndenter(IndentOptions.fromOptions(new LanguageOptions(configuration, ID)));
    }
}
