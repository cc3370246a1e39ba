package com.oyemi.lexicon.model;

/**
 * A lexicon row as stored, with the code kept as raw text so malformed values can still be inspected.
 */
public record LexiconRow(String word, String code, long priority) {

    public static LexiconRow of(EncodedSense sense) {
        return new LexiconRow(sense.word(), sense.code().format(), sense.priority());
    }
}
