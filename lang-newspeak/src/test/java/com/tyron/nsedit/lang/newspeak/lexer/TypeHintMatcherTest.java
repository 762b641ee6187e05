package com.tyron.nsedit.lang.newspeak.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TypeHintMatcherTest {

    @Test
    public void forwardMatchEndsAfterClosingAngle() {
        String text = "x <List[Int, Str]> = y";
        assertEquals(18, TypeHintMatcher.matchForward(text, 2));
        assertEquals(-1, TypeHintMatcher.matchForward(text, 0));
    }

    @Test
    public void forwardMatchFailsOnComparison() {
        assertEquals(-1, TypeHintMatcher.matchForward("a < b", 2));
        assertEquals(-1, TypeHintMatcher.matchForward("a <b", 2));
        assertEquals(-1, TypeHintMatcher.matchForward("<Foo\n>", 0));
        assertEquals(-1, TypeHintMatcher.matchForward("a < b > c", 2));
        assertEquals(-1, TypeHintMatcher.matchForward("a <b > c", 2));
    }

    @Test
    public void blanksOnlyAroundArguments() {
        assertTrue(TypeHintMatcher.matches("<Map[ Key , Value ]>"));
        assertTrue(TypeHintMatcher.matches("<List [Int]>"));
        assertFalse(TypeHintMatcher.matches("< Foo>"));
        assertFalse(TypeHintMatcher.matches("<Foo >"));
        assertFalse(TypeHintMatcher.matches("<List[Int] >"));
        assertEquals(-1, TypeHintMatcher.matchBackward("a < b >", 7));
    }

    @Test
    public void backwardMatchFindsOpeningAngle() {
        String text = "x <List[Int, Str]>";
        assertEquals(2, TypeHintMatcher.matchBackward(text, text.length()));
        assertEquals(0, TypeHintMatcher.matchBackward("<Foo>", 5));
    }

    @Test
    public void backwardMatchRejectsNonHints() {
        assertEquals(-1, TypeHintMatcher.matchBackward("a[1]>", 5));
        assertEquals(-1, TypeHintMatcher.matchBackward("a > b ]>", 8));
        assertEquals(-1, TypeHintMatcher.matchBackward("<Foo\nBar]>", 10));
        assertEquals(-1, TypeHintMatcher.matchBackward("abc", 3));
    }
}
