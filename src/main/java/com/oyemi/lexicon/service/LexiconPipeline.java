package com.oyemi.lexicon.service;

import com.oyemi.lexicon.source.BaseFormResolver;
import com.oyemi.lexicon.source.KnowledgeBase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Runs encoding, antonym propagation and override enforcement, strictly in that order.
 * Each stage reads the previous stage's snapshot and returns a new one.
 */
@Service
@RequiredArgsConstructor
public class LexiconPipeline {

    private final LexiconAssembler assembler;
    private final ValenceResolver valenceResolver;

    public PipelineResult run(KnowledgeBase knowledgeBase, BaseFormResolver baseFormResolver) {
        AssemblyResult assembly = assembler.assemble(knowledgeBase, baseFormResolver);
        StageResult propagation = valenceResolver.propagateAntonyms(assembly.snapshot(), assembly.antonyms());
        StageResult overrides = valenceResolver.enforceOverrides(propagation.snapshot());
        return new PipelineResult(assembly, propagation, overrides);
    }
}
