package com.oyemi.lexicon.service;

import com.oyemi.lexicon.model.LexiconSnapshot;

/**
 * The three sequential stages of one build, each kept so it can be persisted or inspected on its own.
 */
public record PipelineResult(AssemblyResult assembly, StageResult propagation, StageResult overrides) {

    public LexiconSnapshot finalSnapshot() {
        return overrides.snapshot();
    }
}
