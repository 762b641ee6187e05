package com.tyron.nsedit.api.editor;

/**
 * Abstract view of the Code Editor component.
 */
public interface Editor {
    Document getDocument();

    /**
     * @return Name of the file shown in this editor, used to pick the language (e.g. "Collections.ns").
     */
    String getFileName();

    Carets getCaretModel();

    interface Carets {
        int getOffset();
        void moveToOffset(int offset);
    }
}
