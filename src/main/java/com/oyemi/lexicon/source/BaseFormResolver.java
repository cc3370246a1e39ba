package com.oyemi.lexicon.source;

/**
 * Reduces an inflected surface word to its dictionary base form.
 */
public interface BaseFormResolver {

    /**
     * @return the base form, or the word itself when it has none
     */
    String baseForm(String word);

    static BaseFormResolver identity() {
        return word -> word;
    }
}
