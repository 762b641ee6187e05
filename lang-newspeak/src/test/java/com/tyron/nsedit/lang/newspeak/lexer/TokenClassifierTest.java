package com.tyron.nsedit.lang.newspeak.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tyron.nsedit.lang.newspeak.lexer.TokenCategory.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

public class TokenClassifierTest {

    @Test
    public void punctuation() {
        assertEquals(OPEN_PAREN, TokenClassifier.classify("("));
        assertEquals(CLOSE_PAREN, TokenClassifier.classify(")"));
        assertEquals(OPEN_BLOCK, TokenClassifier.classify("["));
        assertEquals(CLOSE_BLOCK, TokenClassifier.classify("]"));
        assertEquals(RETURN, TokenClassifier.classify("^"));
        assertEquals(PIPE, TokenClassifier.classify("|"));
        assertEquals(OTHER, TokenClassifier.classify("."));
        assertEquals(OTHER, TokenClassifier.classify(">="));
    }

    @Test
    public void words() {
        assertEquals(CLASS, TokenClassifier.classify("class"));
        assertEquals(CLASS_NAME, TokenClassifier.classify("OrderedCollection"));
        assertEquals(IDENTIFIER, TokenClassifier.classify("classy"));
        assertEquals(IDENTIFIER, TokenClassifier.classify("_tmp"));
        assertEquals(MODIFIER, TokenClassifier.classify("private"));
        assertEquals(MODIFIER, TokenClassifier.classify("public"));
        assertEquals(MODIFIER, TokenClassifier.classify("protected"));
        assertEquals(OTHER, TokenClassifier.classify("42"));
    }

    @Test
    public void colonsMarkSendsAndParameters() {
        assertEquals(KEYWORD_OR_SETTER_SEND, TokenClassifier.classify("at:"));
        assertEquals(KEYWORD_OR_SETTER_SEND, TokenClassifier.classify("at:put:"));
        assertEquals(KEYWORD_OR_SETTER_SEND, TokenClassifier.classify("items::"));
        assertEquals(OTHER, TokenClassifier.classify("items:::"));
        assertEquals(IDENTIFIER, TokenClassifier.classify(":each"));
        assertEquals(OTHER, TokenClassifier.classify(":"));
        assertEquals(OTHER, TokenClassifier.classify("::"));
    }

    @Test
    public void typeHintsAreSingleTokens() {
        assertEquals(TYPE_HINT, TokenClassifier.classify("<String>"));
        assertEquals(TYPE_HINT, TokenClassifier.classify("<Foo[Bar, Baz]>"));
        assertEquals(TYPE_HINT, TokenClassifier.classify("<Foo[Bar,Baz]>"));
        assertEquals(OTHER, TokenClassifier.classify("<Foo[Bar,]>"));
        assertEquals(OTHER, TokenClassifier.classify("<"));
    }

    @Test
    public void commentsAndStrings() {
        assertEquals(COMMENT, TokenClassifier.classify("(* note *)"));
        assertEquals(COMMENT, TokenClassifier.classify("\"note\""));
        assertEquals(COMMENT, TokenClassifier.classify("(* unterminated"));
        assertEquals(STRING_DELIMITER, TokenClassifier.classify("'it''s'"));
    }

    @Test
    public void everyLexemeGetsACategory() {
        List<String> lexemes = List.of("(", "a", "Ä", "ß:", "é", "::=", "#", "#sym", "$a", "1.5e3", " ",
                "~~", "{", "}", "<>", "]>", "@", "_", "x_1:", "(*", "'", "\"");
        for (String lexeme : lexemes) {
            assertNotNull(TokenClassifier.classify(lexeme), lexeme);
        }
        assertEquals(OTHER, TokenClassifier.classify(""));
        assertEquals(OTHER, TokenClassifier.classify(null));
    }
}
