package com.oyemi.lexicon.model;

/**
 * Point rewrite of one stored code, addressed by its exact previous value.
 */
public record CodeUpdate(String word, SemanticCode oldCode, SemanticCode newCode) {
}
