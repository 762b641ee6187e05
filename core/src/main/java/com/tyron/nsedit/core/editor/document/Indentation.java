package com.tyron.nsedit.core.editor.document;

/**
 * Column arithmetic for leading blanks. Tabs advance to the next multiple of {@link #TAB_SIZE}.
 */
public final class Indentation {

    public static final int TAB_SIZE = 8;

    private Indentation() {
    }

    /**
     * @return Offset of the first character in [from, to) that is neither a space nor a tab, or {@code to}.
     */
    public static int skipBlanks(CharSequence text, int from, int to) {
        int i = from;
        while (i < to && isBlank(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * @return Display width of the blanks in [from, to), starting at column 0.
     */
    public static int width(CharSequence text, int from, int to) {
        int column = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\t') {
                column = (column / TAB_SIZE + 1) * TAB_SIZE;
            } else {
                column++;
            }
        }
        return column;
    }

    public static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
