package com.tyron.nsedit.core.editor;

import com.tyron.nsedit.api.editor.Document;
import com.tyron.nsedit.api.editor.Editor;

import java.util.Objects;

/**
 * Minimal {@link Editor} implementation.
 *
 * This does not render anything; it only provides caret state, the file name and the document reference.
 */
public final class SimpleEditor implements Editor {

    private final Document document;
    private final String fileName;
    private final SimpleCarets carets = new SimpleCarets();

    public SimpleEditor(Document document, String fileName) {
        this.document = Objects.requireNonNull(document, "document");
        this.fileName = Objects.requireNonNull(fileName, "fileName");
    }

    @Override
    public Document getDocument() {
        return document;
    }

    @Override
    public String getFileName() {
        return fileName;
    }

    @Override
    public Carets getCaretModel() {
        return carets;
    }

    private final class SimpleCarets implements Carets {
        private volatile int offset;

        @Override
        public int getOffset() {
            return offset;
        }

        @Override
        public void moveToOffset(int offset) {
            int length = document.getTextLength();
            if (offset < 0 || offset > length) {
                throw new IllegalArgumentException("offset " + offset + " is outside [0, " + length + "]");
            }
            this.offset = offset;
        }
    }
}
