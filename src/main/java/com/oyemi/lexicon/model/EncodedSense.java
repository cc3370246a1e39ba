package com.oyemi.lexicon.model;

/**
 * One (word, code, priority) row of the lexicon.
 */
public record EncodedSense(String word, SemanticCode code, long priority) {

    public EncodedSense withCode(SemanticCode newCode) {
        return new EncodedSense(word, newCode, priority);
    }

    public String key() {
        return word + '\t' + code.format();
    }
}
