package com.tyron.nsedit.lang.newspeak.lexer;

import com.tyron.nsedit.lang.newspeak.text.SourceSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.tyron.nsedit.lang.newspeak.lexer.TokenCategory.*;
import static org.junit.jupiter.api.Assertions.*;

public class TokenScannerTest {

    private static final String MIXED = "foo: 'a''b' (* c *) <List[Int, Str]> x>=y ]> ^ :p";

    private static final String COLLECTIONS = """
            class Collections = (
            (* A comment *)
            | private items <List[Item]> = List new. |
            ) (
            public add: item <Item> = (
              items add: item.
              ^items inject: 0 into: [:acc :each | acc + each size]
            )
            )
            """;

    private static TokenScanner scanner(String text) {
        return new TokenScanner(new SourceSnapshot(text));
    }

    private static List<Token> forwardAll(TokenScanner scanner) {
        List<Token> tokens = new ArrayList<>();
        scanner.tokensAfter(0).forEach(tokens::add);
        return tokens;
    }

    private static List<String> texts(List<Token> tokens) {
        List<String> result = new ArrayList<>();
        for (Token token : tokens) {
            result.add(token.text());
        }
        return result;
    }

    private static List<TokenCategory> categories(List<Token> tokens) {
        List<TokenCategory> result = new ArrayList<>();
        for (Token token : tokens) {
            result.add(token.category());
        }
        return result;
    }

    @Test
    public void forwardScanSplitsMixedInput() {
        List<Token> tokens = forwardAll(scanner(MIXED));

        assertEquals(List.of("foo:", "'a''b'", "(* c *)", "<List[Int, Str]>", "x", ">=", "y", "]", ">", "^", ":p"),
                texts(tokens));
        assertEquals(List.of(KEYWORD_OR_SETTER_SEND, STRING_DELIMITER, COMMENT, TYPE_HINT, IDENTIFIER, OTHER,
                IDENTIFIER, CLOSE_BLOCK, OTHER, RETURN, IDENTIFIER), categories(tokens));
    }

    @Test
    public void backwardScanMirrorsForwardScan() {
        TokenScanner scanner = scanner(MIXED);
        List<Token> forward = forwardAll(scanner);

        List<Token> backward = new ArrayList<>();
        scanner.tokensBefore(MIXED.length()).forEach(backward::add);
        Collections.reverse(backward);

        assertEquals(forward, backward);
    }

    @Test
    public void backwardOfForwardReturnsToTokenStart() {
        for (String text : List.of(COLLECTIONS, MIXED, "public foo: x <Integer>= (", "x <Int>>= y", "a < b > c", "a[1]>= b")) {
            TokenScanner scanner = scanner(text);
            List<Token> tokens = forwardAll(scanner);
            assertFalse(tokens.isEmpty());

            for (Token token : tokens) {
                Token forward = scanner.forwardToken(token.start());
                assertEquals(token, forward);
                assertEquals(token.start(), scanner.backwardToken(forward.end()).start(),
                        "round trip of '" + token.text() + "' in '" + text + "'");
            }
        }
    }

    @Test
    public void operatorAfterTypeHintLeavesHintWhole() {
        String text = "public foo: x <Integer>= (";
        TokenScanner scanner = scanner(text);

        List<Token> backward = new ArrayList<>();
        scanner.tokensBefore(text.length()).forEach(backward::add);
        Collections.reverse(backward);

        assertEquals(List.of("public", "foo:", "x", "<Integer>", "=", "("), texts(backward));
        assertEquals(TYPE_HINT, backward.get(3).category());
        assertEquals(forwardAll(scanner), backward);

        TokenScanner shift = scanner("x <Int>>= y");
        Token operator = shift.backwardToken(9);
        assertEquals(">=", operator.text());
        assertEquals("<Int>", shift.backwardToken(operator.start()).text());
    }

    @Test
    public void spacedComparisonIsNotATypeHint() {
        List<Token> tokens = forwardAll(scanner("a < b > c"));

        assertEquals(List.of("a", "<", "b", ">", "c"), texts(tokens));
        assertTrue(tokens.stream().noneMatch(t -> t.is(TYPE_HINT)));
    }

    @Test
    public void typeHintStaysWholeInsideSlotDeclaration() {
        List<Token> tokens = forwardAll(scanner("| private items <List[Item]> = List new. |"));
        assertTrue(tokens.stream().anyMatch(t -> t.is(TYPE_HINT) && t.text().equals("<List[Item]>")));
    }

    @Test
    public void failedTypeHintFallsBackToLiterals() {
        TokenScanner scanner = scanner("a < b");
        Token lt = scanner.forwardToken(1);
        assertEquals("<", lt.text());
        assertEquals(OTHER, lt.category());
        assertEquals(3, lt.end());

        TokenScanner closing = scanner("a[1]> b");
        Token gt = closing.backwardToken(5);
        assertEquals(">", gt.text());
        Token bracket = closing.backwardToken(gt.start());
        assertEquals("]", bracket.text());
        assertEquals(CLOSE_BLOCK, bracket.category());
    }

    @Test
    public void backwardFromInsideStringReturnsWholeString() {
        String text = "x := 'abc def' size";
        TokenScanner scanner = scanner(text);
        int inside = text.indexOf("def");

        Token token = scanner.backwardToken(inside);

        assertEquals("'abc def'", token.text());
        assertEquals(STRING_DELIMITER, token.category());
        assertEquals(text.indexOf('\''), token.start());
        assertTrue(scanner.getBuffer().inString(inside));
    }

    @Test
    public void backwardFromInsideCommentReturnsWholeComment() {
        String text = "a (* one\ntwo *) b";
        TokenScanner scanner = scanner(text);

        Token token = scanner.backwardToken(text.indexOf("two"));

        assertEquals(COMMENT, token.category());
        assertEquals(2, token.start());
        assertEquals("a", scanner.backwardToken(token.start()).text());
    }

    @Test
    public void unterminatedCommentRunsToEndAndScansStop() {
        String text = "foo (* never closed";
        TokenScanner scanner = scanner(text);

        List<Token> tokens = forwardAll(scanner);
        assertEquals(List.of("foo", "(* never closed"), texts(tokens));

        Token last = scanner.backwardToken(text.length());
        assertEquals(COMMENT, last.category());
        assertTrue(scanner.forwardToken(text.length()).isBoundary());
    }

    @Test
    public void boundaryTokensAtBufferEdges() {
        TokenScanner scanner = scanner("  x  ");
        assertTrue(scanner.backwardToken(1).isBoundary());
        assertEquals(0, scanner.backwardToken(1).start());
        assertTrue(scanner.forwardToken(3).isBoundary());
        assertEquals(5, scanner.forwardToken(3).end());

        TokenScanner empty = scanner("");
        assertTrue(empty.forwardToken(0).isBoundary());
        assertTrue(empty.backwardToken(0).isBoundary());
    }

    @Test
    public void significantIteratorsSkipComments() {
        TokenScanner scanner = scanner("a (* x *) b \"y\" c");
        List<String> texts = new ArrayList<>();
        for (Token token : scanner.significantTokensAfter(0)) {
            texts.add(token.text());
        }
        assertEquals(List.of("a", "b", "c"), texts);
    }

    @Test
    public void scanAheadAndBehindLimitCount() {
        TokenScanner scanner = scanner("class Foo = ( )");

        assertEquals(List.of("class", "Foo", "="), texts(scanner.scanAhead(0, 3)));
        assertEquals(List.of(")", "("), texts(scanner.scanBehind(15, 2)));
        assertEquals(5, scanner.scanAhead(0, 10).size());
        assertTrue(scanner.scanBehind(0, 3).isEmpty());
    }

    @Test
    public void outOfRangeOffsetsAreRejected() {
        TokenScanner scanner = scanner("abc");
        assertThrows(IndexOutOfBoundsException.class, () -> scanner.forwardToken(4));
        assertThrows(IndexOutOfBoundsException.class, () -> scanner.backwardToken(-1));
    }
}
