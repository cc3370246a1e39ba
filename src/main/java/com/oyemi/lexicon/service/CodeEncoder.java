package com.oyemi.lexicon.service;

import com.oyemi.lexicon.model.Abstractness;
import com.oyemi.lexicon.model.PartOfSpeech;
import com.oyemi.lexicon.model.SemanticCode;
import com.oyemi.lexicon.model.Valence;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Assembles {@code HHHH-LLLLL-P-A-V} codes and hands out per-superclass sequence numbers.
 */
@Service
public class CodeEncoder {

    static final int MAX_LOCAL_SEQUENCE = 99_999;

    public SemanticCode encode(String superclass, int localSequence, PartOfSpeech pos,
                               Abstractness abstractness, Valence valence) {
        return new SemanticCode(superclass, localSequence, pos, abstractness, valence);
    }

    /**
     * Fresh counters for one build. Numbers start at 1 for each superclass and grow by one
     * per concept, in the order concepts are visited.
     */
    public SequenceCounter newCounter() {
        return new SequenceCounter();
    }

    public static final class SequenceCounter {

        private final Map<String, Integer> counters = new HashMap<>();

        private SequenceCounter() {
        }

        public int next(String superclass) {
            int next = counters.merge(superclass, 1, Integer::sum);
            if (next > MAX_LOCAL_SEQUENCE) {
                throw new IllegalStateException("Superclass " + superclass + " exceeded "
                        + MAX_LOCAL_SEQUENCE + " concepts");
            }
            return next;
        }
    }
}
