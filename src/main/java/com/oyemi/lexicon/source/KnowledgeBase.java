package com.oyemi.lexicon.source;

import com.oyemi.lexicon.model.Concept;

import java.util.stream.Stream;

/**
 * Read-only view of the lexical knowledge base.
 * <p>
 * Every call must enumerate the same concepts in the same order; sequence numbers
 * in the produced codes depend on it.
 */
public interface KnowledgeBase {

    Stream<Concept> concepts();
}
