package com.oyemi.lexicon.service;

import com.oyemi.lexicon.config.ValenceOverrides;
import com.oyemi.lexicon.model.AntonymLink;
import com.oyemi.lexicon.model.CodeUpdate;
import com.oyemi.lexicon.model.EncodedSense;
import com.oyemi.lexicon.model.LexiconSnapshot;
import com.oyemi.lexicon.model.SentimentScore;
import com.oyemi.lexicon.model.Valence;
import com.oyemi.lexicon.model.ValenceStrength;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Decides the valence digit of every code.
 * <p>
 * Stages run in a fixed order: the lexical comparison of sentiment scores (with
 * overrides applied on top while encoding), then {@link #propagateAntonyms} over the
 * complete lexicon, then {@link #enforceOverrides} as the terminal pass. Running the
 * override pass last is what guarantees an overridden word can never be changed by
 * propagation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ValenceResolver {

    static final double STRONG_THRESHOLD = 0.25;
    static final double WEAK_THRESHOLD = 0.1;

    private final ValenceOverrides overrides;

    /**
     * Strictly larger score wins; equal scores, including 0 vs 0, are neutral.
     */
    public Valence lexical(SentimentScore score) {
        if (score == null) {
            return Valence.NEUTRAL;
        }
        if (score.positive() > score.negative()) {
            return Valence.POSITIVE;
        }
        if (score.negative() > score.positive()) {
            return Valence.NEGATIVE;
        }
        return Valence.NEUTRAL;
    }

    public ValenceStrength strength(SentimentScore score) {
        if (score == null || lexical(score) == Valence.NEUTRAL) {
            return ValenceStrength.NONE;
        }
        double winner = Math.max(score.positive(), score.negative());
        if (winner >= STRONG_THRESHOLD) {
            return ValenceStrength.STRONG;
        }
        if (winner >= WEAK_THRESHOLD) {
            return ValenceStrength.WEAK;
        }
        return ValenceStrength.FAINT;
    }

    public Optional<Valence> override(String word) {
        return overrides.lookup(word);
    }

    /**
     * Lexical valence with the override for {@code word} applied on top.
     */
    public Valence resolve(SentimentScore score, String word) {
        return overrides.lookup(word).orElseGet(() -> lexical(score));
    }

    /**
     * Gives undecided words the opposite polarity of a decided antonym.
     * <p>
     * A word's current valence is that of its primary (highest-priority) sense. For
     * every pair where both words are present and neither is overridden, if exactly
     * one side is neutral, every neutral code of that side takes the opposite of the
     * other side's valence. Pairs where both sides are polar are left alone, and a
     * polar code is never changed. Decisions read the pass input, so the result does
     * not depend on pair order except when one neutral word has antonyms of both
     * polarities: the first pair in lexical order decides and later ones are skipped.
     */
    public StageResult propagateAntonyms(LexiconSnapshot snapshot, Collection<AntonymLink> links) {
        Map<String, AntonymLink> pairs = new TreeMap<>();
        for (AntonymLink link : links) {
            AntonymLink canonical = link.canonical();
            if (!canonical.word().equals(canonical.antonym())) {
                pairs.putIfAbsent(canonical.word() + '\t' + canonical.antonym(), canonical);
            }
        }

        Map<String, Valence> targets = new LinkedHashMap<>();
        for (Map.Entry<String, AntonymLink> entry : pairs.entrySet()) {
            AntonymLink pair = entry.getValue();
            String first = pair.word();
            String second = pair.antonym();
            if (!snapshot.containsWord(first) || !snapshot.containsWord(second)) {
                continue;
            }
            if (overrides.isProtected(first) || overrides.isProtected(second)) {
                continue;
            }

            Valence firstValence = currentValence(snapshot, first);
            Valence secondValence = currentValence(snapshot, second);
            if (firstValence.isPolar() == secondValence.isPolar()) {
                continue;
            }

            String neutralWord = firstValence.isPolar() ? second : first;
            Valence target = (firstValence.isPolar() ? firstValence : secondValence).opposite();
            Valence previous = targets.putIfAbsent(neutralWord, target);
            if (previous != null && previous != target) {
                log.debug("Conflicting antonym evidence for '{}': keeping {}, skipping {} from pair {}",
                        neutralWord, previous, target, entry.getKey());
            }
        }

        List<CodeUpdate> updates = new ArrayList<>();
        targets.forEach((word, target) -> {
            for (EncodedSense sense : snapshot.sensesOf(word)) {
                if (!sense.code().valence().isPolar()) {
                    updates.add(new CodeUpdate(word, sense.code(), sense.code().withValence(target)));
                }
            }
        });

        log.info("Antonym propagation: {} pairs considered, {} words decided, {} codes rewritten",
                pairs.size(), targets.size(), updates.size());
        return new StageResult(snapshot.applying(updates), updates);
    }

    /**
     * Terminal pass: every code of an overridden word carries the override's valence.
     */
    public StageResult enforceOverrides(LexiconSnapshot snapshot) {
        List<CodeUpdate> updates = new ArrayList<>();
        overrides.asMap().forEach((word, valence) -> {
            for (EncodedSense sense : snapshot.sensesOf(word)) {
                if (sense.code().valence() != valence) {
                    updates.add(new CodeUpdate(word, sense.code(), sense.code().withValence(valence)));
                }
            }
        });

        log.info("Override enforcement: {} codes rewritten", updates.size());
        return new StageResult(snapshot.applying(updates), updates);
    }

    private Valence currentValence(LexiconSnapshot snapshot, String word) {
        return snapshot.primarySense(word)
                .map(sense -> sense.code().valence())
                .orElse(Valence.NEUTRAL);
    }
}
