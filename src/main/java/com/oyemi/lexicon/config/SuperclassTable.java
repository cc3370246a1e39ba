package com.oyemi.lexicon.config;

import com.oyemi.lexicon.model.PartOfSpeech;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Curated concept-identifier to superclass-code mapping, plus one fallback code per part of speech.
 */
public final class SuperclassTable {

    private final Map<String, String> codes;
    private final Map<PartOfSpeech, String> fallbacks;

    public SuperclassTable(Map<String, String> codes, Map<PartOfSpeech, String> fallbacks) {
        for (PartOfSpeech pos : PartOfSpeech.values()) {
            if (!fallbacks.containsKey(pos)) {
                throw new IllegalArgumentException("Missing superclass fallback for " + pos);
            }
        }
        this.codes = Collections.unmodifiableMap(new LinkedHashMap<>(codes));
        this.fallbacks = Collections.unmodifiableMap(new EnumMap<>(fallbacks));
    }

    public Optional<String> lookup(String conceptId) {
        return Optional.ofNullable(codes.get(conceptId));
    }

    public String fallback(PartOfSpeech pos) {
        return fallbacks.get(pos);
    }

    public int size() {
        return codes.size();
    }
}
