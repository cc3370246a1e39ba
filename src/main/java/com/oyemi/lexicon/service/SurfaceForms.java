package com.oyemi.lexicon.service;

import java.util.Locale;

/**
 * Normalisation rules for surface words entering the lexicon.
 */
public final class SurfaceForms {

    private SurfaceForms() {
    }

    /**
     * Lowercase, with the knowledge base's underscores turned into spaces.
     */
    public static String normalize(String lemmaName) {
        return lemmaName.toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    /**
     * True when the word, once spaces and hyphens are removed, is a non-empty run of letters.
     */
    public static boolean isAcceptable(String word) {
        String stripped = word.replace(" ", "").replace("-", "");
        return !stripped.isEmpty() && stripped.codePoints().allMatch(Character::isLetter);
    }

    public static boolean isSingleToken(String word) {
        return word.indexOf(' ') < 0 && word.indexOf('-') < 0;
    }
}
