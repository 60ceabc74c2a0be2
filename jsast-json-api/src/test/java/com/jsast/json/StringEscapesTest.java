package com.jsast.json;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StringEscapesTest {

    @Test
    void textWithoutEscapesIsUnchanged() {
        assertEquals("plain text", StringEscapes.cook("plain text"));
        assertEquals("", StringEscapes.cook(""));
    }

    @Test
    void singleCharacterEscapes() {
        assertEquals("a\nb\rc\td\be\ff\u000Bg", StringEscapes.cook("a\\nb\\rc\\td\\be\\ff\\vg"));
        assertEquals("\0", StringEscapes.cook("\\0"));
    }

    @Test
    void escapedQuotesAndBackslashes() {
        assertEquals("it's", StringEscapes.cook("it\\'s"));
        assertEquals("say \"hi\"", StringEscapes.cook("say \\\"hi\\\""));
        assertEquals("a\\b", StringEscapes.cook("a\\\\b"));
    }

    @Test
    void hexAndUnicodeEscapes() {
        assertEquals("A", StringEscapes.cook("\\x41"));
        assertEquals("é", StringEscapes.cook("\\u00e9"));
        assertEquals("é", StringEscapes.cook("\\u{e9}"));
        assertEquals(new String(Character.toChars(0x1F600)), StringEscapes.cook("\\u{1F600}"));
    }

    @Test
    void legacyOctalEscapes() {
        assertEquals("A", StringEscapes.cook("\\101"));
        assertEquals("ÿ", StringEscapes.cook("\\377"));
        assertEquals("'8", StringEscapes.cook("\\478"));
        assertEquals("\u0001", StringEscapes.cook("\\1"));
    }

    @Test
    void lineContinuationsVanish() {
        assertEquals("ab", StringEscapes.cook("a\\\nb"));
        assertEquals("ab", StringEscapes.cook("a\\\r\nb"));
    }

    @Test
    void identityEscapes() {
        assertEquals("q", StringEscapes.cook("\\q"));
    }

    @Test
    void malformedEscapesFallBackToRawText() {
        assertEquals("\\x4", StringEscapes.cook("\\x4"));
        assertEquals("bad \\u12G4 escape", StringEscapes.cook("bad \\u12G4 escape"));
        assertEquals("\\u{110000}", StringEscapes.cook("\\u{110000}"));
        assertEquals("trailing\\", StringEscapes.cook("trailing\\"));
    }
}
