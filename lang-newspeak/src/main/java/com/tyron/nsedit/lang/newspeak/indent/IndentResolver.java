package com.tyron.nsedit.lang.newspeak.indent;

import com.tyron.nsedit.lang.newspeak.text.SourceBuffer;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes a line's indentation by trying {@link IndentRule}s in order; the first rule that answers wins.
 */
public final class IndentResolver {

    private static final Logger LOG = Logger.getLogger(IndentResolver.class.getName());

    private final List<IndentRule> rules;
    private final IndentOptions options;

    public IndentResolver(IndentOptions options) {
        this(IndentRules.defaults(), options);
    }

    public IndentResolver(List<IndentRule> rules, IndentOptions options) {
        this.rules = List.copyOf(rules);
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @param line zero-based line index
     * @return Target column, never negative
     * @throws IndexOutOfBoundsException if the buffer has no such line
     */
    public int computeIndent(SourceBuffer buffer, int line) {
        if (line < 0 || line >= buffer.getLineCount()) {
            throw new IndexOutOfBoundsException("line " + line + " is out of bounds for lineCount=" + buffer.getLineCount());
        }

        IndentRequest request = new IndentRequest(buffer, line, new ContextProbes(buffer), options);
        for (IndentRule rule : rules) {
            OptionalInt column = rule.computeIndent(request);
            if (column.isPresent()) {
                int result = Math.max(0, column.getAsInt());
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("computeIndent line=" + line + " rule=" + rule.getId() + " column=" + result);
                }
                return result;
            }
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("computeIndent line=" + line + " rule=none column=0");
        }
        return 0;
    }
}
