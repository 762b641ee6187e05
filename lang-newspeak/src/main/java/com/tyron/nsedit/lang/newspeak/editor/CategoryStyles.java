package com.tyron.nsedit.lang.newspeak.editor;

import com.tyron.nsedit.api.editor.TokenSpan.TokenType;
import com.tyron.nsedit.lang.newspeak.lexer.TokenCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Display style of each token category. Categories without an entry are rendered unstyled.
 */
public final class CategoryStyles {

    private static final Map<TokenCategory, TokenType> STYLES;

    static {
        EnumMap<TokenCategory, TokenType> styles = new EnumMap<>(TokenCategory.class);
        styles.put(TokenCategory.CLASS, TokenType.KEYWORD);
        styles.put(TokenCategory.MODIFIER, TokenType.KEYWORD);
        styles.put(TokenCategory.RETURN, TokenType.KEYWORD);
        styles.put(TokenCategory.CLASS_NAME, TokenType.TYPE);
        styles.put(TokenCategory.TYPE_HINT, TokenType.TYPE);
        styles.put(TokenCategory.KEYWORD_OR_SETTER_SEND, TokenType.METHOD);
        styles.put(TokenCategory.STRING_DELIMITER, TokenType.STRING);
        styles.put(TokenCategory.COMMENT, TokenType.COMMENT);
        STYLES = Collections.unmodifiableMap(styles);
    }

    private CategoryStyles() {
    }

    /**
     * @return The style for the category, or null if it is not styled
     */
    public static TokenType styleOf(TokenCategory category) {
        return STYLES.get(category);
    }

    public static Map<TokenCategory, TokenType> asMap() {
        return STYLES;
    }
}
