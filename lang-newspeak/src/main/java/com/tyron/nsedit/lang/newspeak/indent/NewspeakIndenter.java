package com.tyron.nsedit.lang.newspeak.indent;

import com.tyron.nsedit.api.editor.Document;
import com.tyron.nsedit.api.editor.Indenter;
import com.tyron.nsedit.lang.newspeak.text.SourceSnapshot;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * {@link Indenter} for Newspeak documents. Each call works on a fresh snapshot of the document.
 */
public final class NewspeakIndenter implements Indenter {

    private final IndentResolver resolver;

    public NewspeakIndenter(IndentOptions options) {
        this(new IndentResolver(options));
    }

    public NewspeakIndenter(IndentResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public int computeIndent(@NotNull Document document, int line) {
        return resolver.computeIndent(SourceSnapshot.of(document), line);
    }
}
