package com.oyemi.lexicon.model;

import java.util.List;

/**
 * A surface form of a concept.
 *
 * @param name      surface form as the knowledge base spells it (underscores for spaces)
 * @param frequency corpus frequency count of this sense
 * @param antonyms  surface forms of antonym lemmas
 * @param ordinal   zero-based position in the concept's lemma list
 */
public record Lemma(String name, int frequency, List<String> antonyms, int ordinal) {

    public Lemma {
        antonyms = antonyms == null ? List.of() : List.copyOf(antonyms);
    }

    public Lemma(String name, int frequency, int ordinal) {
        this(name, frequency, List.of(), ordinal);
    }
}
