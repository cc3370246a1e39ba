package com.oyemi.lexicon.service;

import com.oyemi.lexicon.model.AntonymLink;
import com.oyemi.lexicon.model.LexiconSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Everything the encoding pass produces before the valence fix-up passes run.
 *
 * @param snapshot  encoded rows in concept visitation order
 * @param baseForms word to base form, only where they differ
 * @param antonyms  normalised antonym links, deduplicated, in discovery order
 * @param stats     per-concept counters
 */
public record AssemblyResult(LexiconSnapshot snapshot,
                             Map<String, String> baseForms,
                             List<AntonymLink> antonyms,
                             AssemblyStats stats) {
}
