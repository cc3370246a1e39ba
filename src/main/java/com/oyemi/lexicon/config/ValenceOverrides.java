package com.oyemi.lexicon.config;

import com.oyemi.lexicon.model.Valence;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Manually fixed polarities keyed by lowercase surface word.
 */
public final class ValenceOverrides {

    private final Map<String, Valence> overrides;

    public ValenceOverrides(Map<String, Valence> overrides) {
        Map<String, Valence> normalized = new TreeMap<>();
        overrides.forEach((word, valence) -> {
            if (!valence.isPolar()) {
                throw new IllegalArgumentException("Override for '" + word + "' must be positive or negative");
            }
            Valence previous = normalized.put(word.toLowerCase(Locale.ROOT), valence);
            if (previous != null && previous != valence) {
                throw new IllegalArgumentException("Conflicting overrides for '" + word + "'");
            }
        });
        this.overrides = Collections.unmodifiableMap(normalized);
    }

    public Optional<Valence> lookup(String word) {
        if (word == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(overrides.get(word.toLowerCase(Locale.ROOT)));
    }

    public boolean isProtected(String word) {
        return lookup(word).isPresent();
    }

    public Map<String, Valence> asMap() {
        return overrides;
    }
}
