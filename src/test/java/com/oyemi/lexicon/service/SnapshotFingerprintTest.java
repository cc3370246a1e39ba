package com.oyemi.lexicon.service;

import com.oyemi.lexicon.model.LexiconRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotFingerprintTest {

    private final SnapshotFingerprint fingerprint = new SnapshotFingerprint();

    @Test
    void testRowOrderDoesNotMatter() {
        LexiconRow a = new LexiconRow("happy", "3010-00001-3-2-1", 10_040);
        LexiconRow b = new LexiconRow("sad", "3011-00001-3-2-2", 10_020);

        assertEquals(fingerprint.fingerprint(List.of(a, b)), fingerprint.fingerprint(List.of(b, a)));
    }

    @Test
    void testPriorityChangesFingerprint() {
        String before = fingerprint.fingerprint(List.of(new LexiconRow("happy", "3010-00001-3-2-1", 10_040)));
        String after = fingerprint.fingerprint(List.of(new LexiconRow("happy", "3010-00001-3-2-1", 10_041)));

        assertNotEquals(before, after);
        assertEquals(64, before.length());
    }

    @Test
    void testEmptyLexiconHasStableFingerprint() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                fingerprint.fingerprint(List.of()));
    }

    @Test
    void testLowBytesKeepLeadingZero() {
        assertEquals("0924bc29608c43225cdb9c48f57ff388799fd42a2f09e0d51f27fc7c218afb58",
                fingerprint.fingerprint(List.of(new LexiconRow("cold", "0001-00001-1-1-0", 5))));
    }
}
