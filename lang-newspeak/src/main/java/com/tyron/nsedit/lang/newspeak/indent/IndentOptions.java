package com.tyron.nsedit.lang.newspeak.indent;

import com.tyron.nsedit.api.settings.LanguageOptions;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Indentation settings handed to the {@link IndentResolver}.
 *
 * @param indentUnit columns added per indentation level
 */
public record IndentOptions(int indentUnit) {

    private static final Logger LOG = Logger.getLogger(IndentOptions.class.getName());

    public static final String INDENT_UNIT_KEY = "indentUnit";
    public static final int DEFAULT_INDENT_UNIT = 2;

    public IndentOptions {
        if (indentUnit < 0) {
            throw new IllegalArgumentException("indentUnit < 0: " + indentUnit);
        }
    }

    public static IndentOptions defaults() {
        return new IndentOptions(DEFAULT_INDENT_UNIT);
    }

    /**
     * Reads {@value #INDENT_UNIT_KEY}; a missing, non-numeric or negative value yields the default.
     */
    public static IndentOptions fromOptions(LanguageOptions options) {
        String raw = options.get(INDENT_UNIT_KEY);
        try {
            return new IndentOptions(options.getInt(INDENT_UNIT_KEY, DEFAULT_INDENT_UNIT));
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            if (LOG.isLoggable(Level.WARNING)) {
                LOG.warning("indentOptions action=default reason=invalid language=" + options.getLanguageId()
                        + " " + INDENT_UNIT_KEY + "=" + raw);
            }
            return defaults();
        }
    }
}
