package com.oyemi.lexicon.service;

import com.oyemi.lexicon.config.ValenceOverrides;
import com.oyemi.lexicon.model.AntonymLink;
import com.oyemi.lexicon.model.EncodedSense;
import com.oyemi.lexicon.model.LexiconSnapshot;
import com.oyemi.lexicon.model.SemanticCode;
import com.oyemi.lexicon.model.SentimentScore;
import com.oyemi.lexicon.model.Valence;
import com.oyemi.lexicon.model.ValenceStrength;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValenceResolverTest {

    private ValenceResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ValenceResolver(new ValenceOverrides(Map.of(
                "fired", Valence.NEGATIVE,
                "hired", Valence.POSITIVE)));
    }

    private static EncodedSense sense(String word, String code, long priority) {
        return new EncodedSense(word, SemanticCode.parse(code), priority);
    }

    private static String codeOf(LexiconSnapshot snapshot, String word, int index) {
        return snapshot.sensesOf(word).get(index).code().format();
    }

    @Test
    void testLexicalStrictlyLargerScoreWins() {
        assertEquals(Valence.NEGATIVE, resolver.lexical(new SentimentScore(0.05, 0.40)));
        assertEquals(Valence.POSITIVE, resolver.lexical(new SentimentScore(0.125, 0.0)));
        assertEquals(Valence.NEUTRAL, resolver.lexical(new SentimentScore(0.25, 0.25)));
        assertEquals(Valence.NEUTRAL, resolver.lexical(SentimentScore.NONE));
    }

    @Test
    void testStrengthOnlyLabelsMagnitude() {
        assertEquals(ValenceStrength.STRONG, resolver.strength(new SentimentScore(0.0, 0.25)));
        assertEquals(ValenceStrength.WEAK, resolver.strength(new SentimentScore(0.1, 0.0)));
        assertEquals(ValenceStrength.FAINT, resolver.strength(new SentimentScore(0.05, 0.0)));
        assertEquals(ValenceStrength.NONE, resolver.strength(new SentimentScore(0.5, 0.5)));
    }

    @Test
    void testOverrideReplacesLexicalValence() {
        assertEquals(Valence.NEGATIVE, resolver.resolve(new SentimentScore(0.6, 0.0), "Fired"));
        assertEquals(Valence.POSITIVE, resolver.resolve(new SentimentScore(0.6, 0.0), "glad"));
    }

    @Test
    void testNeutralWordTakesOppositeOfPolarAntonym() {
        LexiconSnapshot snapshot = LexiconSnapshot.of(List.of(
                sense("cold", "3002-00001-3-1-0", 20),
                sense("cold", "0124-00001-1-2-2", 5),
                sense("hot", "3003-00001-3-1-1", 20)));

        StageResult result = resolver.propagateAntonyms(snapshot, List.of(new AntonymLink("hot", "cold")));

        assertEquals("3002-00001-3-1-2", codeOf(result.snapshot(), "cold", 0));
        assertEquals("0124-00001-1-2-2", codeOf(result.snapshot(), "cold", 1));
        assertEquals("3003-00001-3-1-1", codeOf(result.snapshot(), "hot", 0));
        assertEquals(1, result.updates().size());
    }

    @Test
    void testBothPolarPairIsLeftAlone() {
        LexiconSnapshot snapshot = LexiconSnapshot.of(List.of(
                sense("war", "0250-00001-1-2-2", 20),
                sense("peace", "0250-00002-1-2-2", 20)));

        StageResult result = resolver.propagateAntonyms(snapshot, List.of(new AntonymLink("war", "peace")));

        assertTrue(result.updates().isEmpty());
        assertSame(snapshot, result.snapshot());
    }

    @Test
    void testProtectedWordsAreNotPropagated() {
        LexiconSnapshot snapshot = LexiconSnapshot.of(List.of(
                sense("fired", "2108-00001-2-1-2", 20),
                sense("hired", "2109-00001-2-1-0", 20),
                sense("employed", "3100-00001-3-1-0", 20)));

        StageResult result = resolver.propagateAntonyms(snapshot, List.of(
                new AntonymLink("fired", "hired"),
                new AntonymLink("fired", "employed")));

        assertTrue(result.updates().isEmpty());
    }

    @Test
    void testMissingWordSkipsPair() {
        LexiconSnapshot snapshot = LexiconSnapshot.of(List.of(sense("up", "4000-00001-4-1-1", 10)));

        assertTrue(resolver.propagateAntonyms(snapshot, List.of(new AntonymLink("up", "down"))).updates().isEmpty());
    }

    @Test
    void testConflictingEvidenceFirstPairInLexicalOrderWins() {
        LexiconSnapshot snapshot = LexiconSnapshot.of(List.of(
                sense("calm", "3050-00001-3-1-0", 10),
                sense("agitated", "3051-00001-3-1-2", 10),
                sense("stormy", "3052-00001-3-1-1", 10)));

        StageResult forward = resolver.propagateAntonyms(snapshot, List.of(
                new AntonymLink("calm", "stormy"), new AntonymLink("calm", "agitated")));
        StageResult reversed = resolver.propagateAntonyms(snapshot, List.of(
                new AntonymLink("agitated", "calm"), new AntonymLink("stormy", "calm")));

        assertEquals("3050-00001-3-1-1", codeOf(forward.snapshot(), "calm", 0));
        assertEquals(forward.updates(), reversed.updates());
    }

    @Test
    void testOverrideWinsAfterPropagation() {
        LexiconSnapshot snapshot = LexiconSnapshot.of(List.of(
                sense("fired", "2108-00001-2-1-1", 20),
                sense("fired", "0233-00003-1-2-0", 10),
                sense("hired", "2109-00001-2-1-1", 20)));

        StageResult propagated = resolver.propagateAntonyms(snapshot, List.of(new AntonymLink("fired", "hired")));
        StageResult overridden = resolver.enforceOverrides(propagated.snapshot());

        assertEquals("2108-00001-2-1-2", codeOf(overridden.snapshot(), "fired", 0));
        assertEquals("0233-00003-1-2-2", codeOf(overridden.snapshot(), "fired", 1));
        assertEquals("2109-00001-2-1-1", codeOf(overridden.snapshot(), "hired", 0));
        assertEquals(2, overridden.updates().size());
    }
}
