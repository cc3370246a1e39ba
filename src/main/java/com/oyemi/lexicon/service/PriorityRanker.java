package com.oyemi.lexicon.service;

import org.springframework.stereotype.Service;

/**
 * Ranks the senses of a word so single-sense consumers can pick a primary code.
 * Ranking never changes which codes are produced.
 */
@Service
public class PriorityRanker {

    static final long SPECIFIC_SUPERCLASS_BONUS = 10_000L;
    static final int POSITION_BONUS_CEILING = 10;

    /**
     * @param frequency        corpus frequency of the sense
     * @param specific         whether the superclass came from the table rather than a fallback
     * @param ordinalPosition  zero-based lemma position within its concept
     */
    public long rank(int frequency, boolean specific, int ordinalPosition) {
        long priority = Math.max(0, frequency);
        if (specific) {
            priority += SPECIFIC_SUPERCLASS_BONUS;
        }
        priority += Math.max(0, POSITION_BONUS_CEILING - ordinalPosition);
        return priority;
    }
}
