package com.tyron.nsedit.lang.newspeak.indent;

import java.util.OptionalInt;

/**
 * One entry of the resolver's ordered rule table.
 */
public interface IndentRule {

    String getId();

    /**
     * @return The column for the line, or empty to let the next rule decide
     */
    OptionalInt computeIndent(IndentRequest request);
}
