package com.tyron.nsedit.lang.newspeak.lexer;

import java.util.Set;

/**
 * Maps a raw lexeme to its {@link TokenCategory}. Every lexeme gets a category; unknown shapes are
 * {@link TokenCategory#OTHER}.
 */
public final class TokenClassifier {

    private static final Set<String> MODIFIERS = Set.of("private", "public", "protected");

    private TokenClassifier() {
    }

    public static TokenCategory classify(String lexeme) {
        if (lexeme == null || lexeme.isEmpty()) {
            return TokenCategory.OTHER;
        }

        char first = lexeme.charAt(0);
        if (lexeme.length() == 1) {
            switch (first) {
                case '(': return TokenCategory.OPEN_PAREN;
                case ')': return TokenCategory.CLOSE_PAREN;
                case '[': return TokenCategory.OPEN_BLOCK;
                case ']': return TokenCategory.CLOSE_BLOCK;
                case '^': return TokenCategory.RETURN;
                case '|': return TokenCategory.PIPE;
                default: break;
            }
        }

        if (lexeme.startsWith("(*") || first == '"') {
            return TokenCategory.COMMENT;
        }
        if (first == '\'') {
            return TokenCategory.STRING_DELIMITER;
        }
        if (first == '<') {
            return TypeHintMatcher.matches(lexeme) ? TokenCategory.TYPE_HINT : TokenCategory.OTHER;
        }
        if (!isWord(lexeme)) {
            return TokenCategory.OTHER;
        }

        // :name is a block or keyword parameter
        if (first == ':') {
            return lexeme.length() > 1 && isNameChar(lexeme.charAt(1))
                    ? TokenCategory.IDENTIFIER
                    : TokenCategory.OTHER;
        }
        if (!isNameStart(first)) {
            return TokenCategory.OTHER;
        }

        int colons = trailingColons(lexeme);
        if (colons == 1 || colons == 2) {
            return TokenCategory.KEYWORD_OR_SETTER_SEND;
        }
        if (colons > 2) {
            return TokenCategory.OTHER;
        }

        if ("class".equals(lexeme)) {
            return TokenCategory.CLASS;
        }
        if (MODIFIERS.contains(lexeme)) {
            return TokenCategory.MODIFIER;
        }
        if (Character.isUpperCase(first)) {
            return TokenCategory.CLASS_NAME;
        }
        return TokenCategory.IDENTIFIER;
    }

    /**
     * Word characters are letters, digits, underscore and colon.
     */
    public static boolean isWordChar(char c) {
        return isNameChar(c) || c == ':';
    }

    static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWord(String lexeme) {
        for (int i = 0; i < lexeme.length(); i++) {
            if (!isWordChar(lexeme.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static int trailingColons(String lexeme) {
        int count = 0;
        for (int i = lexeme.length() - 1; i >= 0 && lexeme.charAt(i) == ':'; i--) {
            count++;
        }
        return count;
    }
}
