package com.tyron.nsedit.lang.newspeak.editor;

import com.tyron.nsedit.api.editor.SyntaxHighlighter;
import com.tyron.nsedit.api.editor.TokenSpan;
import com.tyron.nsedit.lang.newspeak.lexer.Token;
import com.tyron.nsedit.lang.newspeak.lexer.TokenScanner;
import com.tyron.nsedit.lang.newspeak.text.SourceSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Highlights Newspeak by scanning the whole text forward and styling tokens through {@link CategoryStyles}.
 */
public class NewspeakSyntaxHighlighter implements SyntaxHighlighter {

    @Override
    public CompletableFuture<List<TokenSpan>> highlight(String content) {
        TokenScanner scanner = new TokenScanner(new SourceSnapshot(content != null ? content : ""));

        List<TokenSpan> spans = new ArrayList<>();
        for (Token token : scanner.tokensAfter(0)) {
            TokenSpan.TokenType type = CategoryStyles.styleOf(token.category());
            if (type != null) {
                spans.add(new TokenSpan(token.start(), token.length(), type));
            }
        }
        return CompletableFuture.completedFuture(spans);
    }
}
