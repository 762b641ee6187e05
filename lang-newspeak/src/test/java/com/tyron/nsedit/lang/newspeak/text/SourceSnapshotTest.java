package com.tyron.nsedit.lang.newspeak.text;

import com.tyron.nsedit.core.editor.document.InMemoryDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceSnapshotTest {

    @Test
    public void findsStringsAndBothCommentForms() {
        SourceSnapshot snapshot = new SourceSnapshot("x 'it''s' (* c *) \"d\" y");

        assertEquals(List.of(
                new SyntaxRegion(SyntaxRegion.Kind.STRING, 2, 9, true),
                new SyntaxRegion(SyntaxRegion.Kind.COMMENT, 10, 17, true),
                new SyntaxRegion(SyntaxRegion.Kind.COMMENT, 18, 21, true)
        ), snapshot.getRegions());
    }

    @Test
    public void doubledQuoteDoesNotCloseString() {
        String text = "'a''b' c";
        SourceSnapshot snapshot = new SourceSnapshot(text);

        assertTrue(snapshot.inString(4));
        assertFalse(snapshot.inString(text.indexOf('c')));
    }

    @Test
    public void contextExcludesOpeningDelimiterAndClosedEnd() {
        SourceSnapshot snapshot = new SourceSnapshot("a (* b *) c");

        assertFalse(snapshot.inComment(2));
        assertTrue(snapshot.inComment(3));
        assertTrue(snapshot.inComment(8));
        assertFalse(snapshot.inComment(9));

        assertNotNull(snapshot.syntaxRegionAt(2));
        assertNull(snapshot.syntaxRegionAt(9));
    }

    @Test
    public void unterminatedRegionEnclosesEndOfText() {
        String text = "x := 'open";
        SourceSnapshot snapshot = new SourceSnapshot(text);

        SyntaxRegion region = snapshot.syntaxContextAt(text.length());
        assertNotNull(region);
        assertFalse(region.terminated());
        assertEquals(text.length(), region.end());
        assertTrue(snapshot.inString(text.length()));
    }

    @Test
    public void commentDelimitersInsideStringsAreIgnored() {
        SourceSnapshot snapshot = new SourceSnapshot("'(* not a comment' x");

        assertEquals(1, snapshot.getRegions().size());
        assertEquals(SyntaxRegion.Kind.STRING, snapshot.getRegions().get(0).kind());
    }

    @Test
    public void lineQueriesExpandTabs() {
        SourceSnapshot snapshot = new SourceSnapshot("a\n\t  b\n   \n");

        assertEquals(4, snapshot.getLineCount());
        assertEquals(0, snapshot.getIndentation(0));
        assertEquals(10, snapshot.getIndentation(1));
        assertEquals(5, snapshot.getFirstNonBlankOffset(1));
        assertEquals(snapshot.getLineEndOffset(2), snapshot.getFirstNonBlankOffset(2));
        assertEquals(1, snapshot.getLineNumber(4));
    }

    @Test
    public void snapshotIsDetachedFromDocument() {
        InMemoryDocument document = new InMemoryDocument("foo");
        SourceSnapshot snapshot = SourceSnapshot.of(document);

        document.insertString(3, " bar");

        assertEquals("foo", snapshot.toString());
    }
}
