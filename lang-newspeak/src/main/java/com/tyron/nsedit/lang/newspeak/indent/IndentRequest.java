package com.tyron.nsedit.lang.newspeak.indent;

import com.tyron.nsedit.lang.newspeak.text.SourceBuffer;

/**
 * Everything an {@link IndentRule} may look at for one line.
 */
public record IndentRequest(SourceBuffer buffer, int line, ContextProbes probes, IndentOptions options) {

    public int lineStart() {
        return buffer.getLineStartOffset(line);
    }

    public int indentUnit() {
        return options.indentUnit();
    }
}
