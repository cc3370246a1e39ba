package com.oyemi.lexicon.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SemanticCodeTest {

    @Test
    void testFormatPadsFields() {
        SemanticCode code = new SemanticCode("0233", 1, PartOfSpeech.NOUN, Abstractness.ABSTRACT, Valence.NEGATIVE);

        assertEquals("0233-00001-1-2-2", code.format());
        assertEquals("0233-00001-1-2-2", code.toString());
    }

    @Test
    void testParseReadsEveryField() {
        SemanticCode code = SemanticCode.parse("3010-00042-3-1-1");

        assertEquals("3010", code.superclass());
        assertEquals(42, code.localSequence());
        assertEquals(PartOfSpeech.ADJECTIVE, code.pos());
        assertEquals(Abstractness.MIXED, code.abstractness());
        assertEquals(Valence.POSITIVE, code.valence());
    }

    @Test
    void testParseRejectsMalformedCodes() {
        assertThrows(IllegalArgumentException.class, () -> SemanticCode.parse("0233-0001-1-2-2"));
        assertThrows(IllegalArgumentException.class, () -> SemanticCode.parse("0233-00001-5-2-2"));
        assertThrows(IllegalArgumentException.class, () -> SemanticCode.parse("0233-00001-1-3-2"));
        assertThrows(IllegalArgumentException.class, () -> SemanticCode.parse("0233-00001-1-2-2 "));
        assertThrows(IllegalArgumentException.class, () -> SemanticCode.parse(null));
    }

    @Test
    void testIsValid() {
        assertTrue(SemanticCode.isValid("0001-99999-4-0-0"));
        assertFalse(SemanticCode.isValid("1-1-1-1-1"));
        assertFalse(SemanticCode.isValid(null));
    }

    @Test
    void testConstructorRejectsOutOfRangeSequence() {
        assertThrows(IllegalArgumentException.class,
                () -> new SemanticCode("0001", 100_000, PartOfSpeech.NOUN, Abstractness.MIXED, Valence.NEUTRAL));
        assertThrows(IllegalArgumentException.class,
                () -> new SemanticCode("001", 1, PartOfSpeech.NOUN, Abstractness.MIXED, Valence.NEUTRAL));
    }

    @Test
    void testWithValenceKeepsOtherFields() {
        SemanticCode code = SemanticCode.parse("0121-00007-1-2-0");

        assertEquals("0121-00007-1-2-1", code.withValence(Valence.POSITIVE).format());
    }
}
