package com.oyemi.lexicon.model;

import java.util.List;

/**
 * One word sense of the knowledge base.
 *
 * @param id        stable identifier in {@code lemma.pos.NN} form, usable as a superclass table key
 * @param pos       part of speech
 * @param paths     hypernym paths in knowledge-base order; may be empty when traversal failed
 * @param sentiment score pair, {@link SentimentScore#NONE} when the sentiment source has no entry
 * @param lemmas    surface forms in their knowledge-base order
 * @param degraded  true when traversal or sentiment lookup failed and defaults were substituted
 */
public record Concept(String id,
                      PartOfSpeech pos,
                      List<HypernymPath> paths,
                      SentimentScore sentiment,
                      List<Lemma> lemmas,
                      boolean degraded) {

    public Concept {
        paths = paths == null ? List.of() : List.copyOf(paths);
        sentiment = sentiment == null ? SentimentScore.NONE : sentiment;
        lemmas = lemmas == null ? List.of() : List.copyOf(lemmas);
    }

    public Concept(String id, PartOfSpeech pos, List<HypernymPath> paths, SentimentScore sentiment, List<Lemma> lemmas) {
        this(id, pos, paths, sentiment, lemmas, false);
    }
}
