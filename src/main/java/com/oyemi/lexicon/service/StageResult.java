package com.oyemi.lexicon.service;

import com.oyemi.lexicon.model.CodeUpdate;
import com.oyemi.lexicon.model.LexiconSnapshot;

import java.util.List;

/**
 * Output of one fix-up pass: the transformed snapshot and the point updates that produce it
 * from the pass input.
 */
public record StageResult(LexiconSnapshot snapshot, List<CodeUpdate> updates) {

    public StageResult {
        updates = List.copyOf(updates);
    }
}
