package com.oyemi.lexicon.model;

/**
 * Directed antonym reference between two normalised surface words. The relation is
 * symmetric; {@link #canonical()} gives the orientation used for deduplication.
 */
public record AntonymLink(String word, String antonym) {

    public AntonymLink canonical() {
        return word.compareTo(antonym) <= 0 ? this : new AntonymLink(antonym, word);
    }
}
