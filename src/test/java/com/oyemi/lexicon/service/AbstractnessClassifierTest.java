package com.oyemi.lexicon.service;

import com.oyemi.lexicon.config.AbstractnessAnchors;
import com.oyemi.lexicon.model.Abstractness;
import com.oyemi.lexicon.model.Concept;
import com.oyemi.lexicon.model.HypernymPath;
import com.oyemi.lexicon.model.PartOfSpeech;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AbstractnessClassifierTest {

    private AbstractnessClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new AbstractnessClassifier(new AbstractnessAnchors(
                Set.of("abstraction.n.06", "feeling.n.01"),
                Set.of("physical_entity.n.01", "person.n.01")));
    }

    private static Concept noun(HypernymPath... paths) {
        return new Concept("c.n.01", PartOfSpeech.NOUN, List.of(paths), null, null);
    }

    @Test
    void testConcreteOnly() {
        assertEquals(Abstractness.CONCRETE, classifier.classify(noun(
                HypernymPath.of("dog.n.01", "animal.n.01", "physical_entity.n.01", "entity.n.01"))));
    }

    @Test
    void testAbstractOnly() {
        assertEquals(Abstractness.ABSTRACT, classifier.classify(noun(
                HypernymPath.of("joy.n.01", "feeling.n.01", "abstraction.n.06", "entity.n.01"))));
    }

    @Test
    void testAnchorsAcrossDifferentPathsGiveMixed() {
        assertEquals(Abstractness.MIXED, classifier.classify(noun(
                HypernymPath.of("worker.n.01", "person.n.01"),
                HypernymPath.of("worker.n.01", "abstraction.n.06"))));
    }

    @Test
    void testNoAnchorsGiveMixed() {
        assertEquals(Abstractness.MIXED, classifier.classify(noun(HypernymPath.of("entity.n.01"))));
        assertEquals(Abstractness.MIXED, classifier.classify(noun()));
    }

    @Test
    void testOverlappingAnchorSetsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new AbstractnessAnchors(Set.of("a.n.01"), Set.of("a.n.01")));
    }
}
