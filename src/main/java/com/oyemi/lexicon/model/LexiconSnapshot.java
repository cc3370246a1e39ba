package com.oyemi.lexicon.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered collection of lexicon rows in which (word, code) is unique.
 * <p>
 * Rows keep their insertion order, which is the concept visitation order of the
 * build. Adding a row whose (word, code) already exists is ignored, matching the
 * insert-or-ignore semantics of the persisted table.
 */
public final class LexiconSnapshot {

    private final List<EncodedSense> entries;
    private final Map<String, List<EncodedSense>> byWord;

    private LexiconSnapshot(List<EncodedSense> entries) {
        this.entries = Collections.unmodifiableList(entries);
        Map<String, List<EncodedSense>> grouped = new LinkedHashMap<>();
        for (EncodedSense sense : entries) {
            grouped.computeIfAbsent(sense.word(), k -> new ArrayList<>()).add(sense);
        }
        grouped.replaceAll((word, senses) -> Collections.unmodifiableList(senses));
        this.byWord = Collections.unmodifiableMap(grouped);
    }

    public static LexiconSnapshot of(Collection<EncodedSense> senses) {
        Map<String, EncodedSense> unique = new LinkedHashMap<>();
        for (EncodedSense sense : senses) {
            unique.putIfAbsent(sense.key(), sense);
        }
        return new LexiconSnapshot(new ArrayList<>(unique.values()));
    }

    public static LexiconSnapshot empty() {
        return new LexiconSnapshot(new ArrayList<>());
    }

    public List<EncodedSense> entries() {
        return entries;
    }

    public boolean containsWord(String word) {
        return byWord.containsKey(word);
    }

    public List<EncodedSense> sensesOf(String word) {
        return byWord.getOrDefault(word, List.of());
    }

    /**
     * Highest-priority sense of a word; ties go to the sense recorded first.
     */
    public Optional<EncodedSense> primarySense(String word) {
        EncodedSense best = null;
        for (EncodedSense sense : sensesOf(word)) {
            if (best == null || sense.priority() > best.priority()) {
                best = sense;
            }
        }
        return Optional.ofNullable(best);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns a new snapshot with each update applied to the row holding its exact old code.
     * Updates addressing a row that does not exist are ignored.
     */
    public LexiconSnapshot applying(List<CodeUpdate> updates) {
        if (updates.isEmpty()) {
            return this;
        }
        Map<String, SemanticCode> rewrites = new HashMap<>();
        for (CodeUpdate update : updates) {
            rewrites.put(update.word() + '\t' + update.oldCode().format(), update.newCode());
        }
        List<EncodedSense> rewritten = new ArrayList<>(entries.size());
        for (EncodedSense sense : entries) {
            SemanticCode replacement = rewrites.get(sense.key());
            rewritten.add(replacement == null ? sense : sense.withCode(replacement));
        }
        return of(rewritten);
    }
}
