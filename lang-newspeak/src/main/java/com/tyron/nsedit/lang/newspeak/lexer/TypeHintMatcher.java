package com.tyron.nsedit.lang.newspeak.lexer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches type hints of the form {@code <Name>} or {@code <Name[Arg, Arg]>} on a single line.
 * <p>
 * Blanks may only appear before and inside the brackets, so {@code a < b > c} stays a comparison.
 */
public final class TypeHintMatcher {

    private static final String NAME = "[\\p{L}\\p{N}_]+";
    private static final String BLANK = "[ \\t]*";

    private static final Pattern TYPE_HINT = Pattern.compile(
            "<" + NAME
                    + "(?:" + BLANK + "\\[" + BLANK + NAME + "(?:" + BLANK + "," + BLANK + NAME + ")*" + BLANK + "\\])?"
                    + ">");

    private TypeHintMatcher() {
    }

    /**
     * @return true if the whole lexeme is one type hint
     */
    public static boolean matches(CharSequence lexeme) {
        return TYPE_HINT.matcher(lexeme).matches();
    }

    /**
     * Lookahead from an opening {@code '<'}.
     *
     * @return End offset (exclusive) of the type hint starting at {@code start}, or -1
     */
    public static int matchForward(CharSequence text, int start) {
        if (start < 0 || start >= text.length() || text.charAt(start) != '<') {
            return -1;
        }
        Matcher m = TYPE_HINT.matcher(text);
        m.region(start, text.length());
        return m.lookingAt() ? m.end() : -1;
    }

    /**
     * Lookbehind from just after a closing {@code '>'}.
     *
     * @return Start offset of the type hint ending exactly at {@code end}, or -1
     */
    public static int matchBackward(CharSequence text, int end) {
        if (end <= 0 || end > text.length() || text.charAt(end - 1) != '>') {
            return -1;
        }
        int i = end - 2;
        while (i >= 0) {
            char c = text.charAt(i);
            if (c == '<') {
                return matchForward(text, i) == end ? i : -1;
            }
            if (c == '\n' || c == '>') {
                return -1;
            }
            i--;
        }
        return -1;
    }
}
