package com.tyron.nsedit.core.editor;

import com.tyron.nsedit.api.editor.Document;
import com.tyron.nsedit.api.editor.Editor;
import com.tyron.nsedit.api.editor.Indenter;
import com.tyron.nsedit.core.editor.document.Indentation;
import org.jetbrains.annotations.NotNull;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editing actions that apply an {@link Indenter} to the caret line of an {@link Editor}.
 */
public final class EditorActions {

    private static final Logger LOG = Logger.getLogger(EditorActions.class.getName());

    private EditorActions() {
    }

    /**
     * Re-indents the line holding the caret.
     * <p>
     * A caret inside the leading blanks ends up after the new indentation; any other caret keeps
     * its position relative to the line's text.
     *
     * @return true if the document was modified
     */
    public static boolean indentLine(@NotNull Editor editor, @NotNull Indenter indenter) {
        Document document = editor.getDocument();
        Editor.Carets carets = editor.getCaretModel();

        int caret = carets.getOffset();
        int line = document.getLineNumber(caret);
        int lineStart = document.getLineStartOffset(line);
        int indentEnd = indentationEnd(document, line);

        int target = indenter.computeIndent(document, line);
        String current = document.getText(lineStart, indentEnd - lineStart);
        int currentColumn = Indentation.width(current, 0, current.length());

        // Equal width keeps the existing blanks, tabs included.
        boolean changed = currentColumn != target;
        String wanted = changed ? " ".repeat(target) : current;
        if (changed) {
            document.replace(lineStart, indentEnd, wanted);
        }

        if (caret <= indentEnd) {
            carets.moveToOffset(lineStart + wanted.length());
        } else {
            carets.moveToOffset(caret + wanted.length() - current.length());
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("indentLine line=" + line + " from=" + currentColumn + " to=" + target + " changed=" + changed);
        }
        return changed;
    }

    /**
     * Inserts a line break at the caret and indents the new line.
     */
    public static void newlineAndIndent(@NotNull Editor editor, @NotNull Indenter indenter) {
        Document document = editor.getDocument();
        Editor.Carets carets = editor.getCaretModel();

        int caret = carets.getOffset();
        document.insertString(caret, "\n");
        carets.moveToOffset(caret + 1);
        indentLine(editor, indenter);
    }

    /**
     * @return Offset of the first character on the line that is neither a space nor a tab.
     */
    public static int indentationEnd(@NotNull Document document, int line) {
        int start = document.getLineStartOffset(line);
        int end = document.getLineEndOffset(line);
        String text = document.getText(start, end - start);
        return start + Indentation.skipBlanks(text, 0, text.length());
    }
}
