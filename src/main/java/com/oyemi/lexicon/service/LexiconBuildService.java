package com.oyemi.lexicon.service;

import com.oyemi.lexicon.config.LexiconProperties;
import com.oyemi.lexicon.config.LexiconTables;
import com.oyemi.lexicon.dto.BuildSummary;
import com.oyemi.lexicon.entity.LexiconEntry;
import com.oyemi.lexicon.model.LexiconRow;
import com.oyemi.lexicon.model.LexiconSnapshot;
import com.oyemi.lexicon.repository.LexiconEntryRepository;
import com.oyemi.lexicon.source.BaseFormResolver;
import com.oyemi.lexicon.source.KnowledgeBase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one full build: encode, persist, then the two fix-up passes, each persisted before the next starts.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LexiconBuildService {

    static final String NOT_FOUND = "NOT FOUND";

    private final LexiconPipeline pipeline;
    private final KnowledgeBase knowledgeBase;
    private final BaseFormResolver baseFormResolver;
    private final LexiconPersistenceService persistenceService;
    private final LexiconEntryRepository lexiconEntryRepository;
    private final SnapshotFingerprint snapshotFingerprint;
    private final LexiconTables tables;
    private final ArtifactLocation artifactLocation;
    private final LexiconProperties properties;

    public BuildSummary build() {
        log.info("Building lexicon into {} (tables v{})", artifactLocation.dataFile(), tables.version());
        long start = System.currentTimeMillis();

        PipelineResult result = pipeline.run(knowledgeBase, baseFormResolver);
        AssemblyResult assembly = result.assembly();
        log.info("Encoded {} concepts into {} rows", assembly.stats().getConcepts(), assembly.snapshot().size());

        persistenceService.insertAll(assembly.snapshot().entries(), assembly.baseForms(), assembly.antonyms());
        int antonymRewrites = persistenceService.applyUpdates("antonym-propagation", result.propagation().updates());
        int overrideRewrites = persistenceService.applyUpdates("valence-overrides", result.overrides().updates());

        BuildSummary summary = summarize(result, antonymRewrites, overrideRewrites);
        log.info("Lexicon built in {} ms: {} words, {} codes, {} mappings",
                System.currentTimeMillis() - start, summary.getUniqueWords(), summary.getUniqueCodes(),
                summary.getTotalMappings());
        return summary;
    }

    private BuildSummary summarize(PipelineResult result, int antonymRewrites, int overrideRewrites) {
        AssemblyResult assembly = result.assembly();
        AssemblyStats stats = assembly.stats();
        LexiconSnapshot snapshot = result.finalSnapshot();

        long words = lexiconEntryRepository.countDistinctWords();
        long mappings = lexiconEntryRepository.count();

        Map<String, Integer> valence = new LinkedHashMap<>();
        stats.getValenceDistribution().forEach((k, v) -> valence.put(k.name(), v));
        Map<String, Integer> strength = new LinkedHashMap<>();
        stats.getStrengthDistribution().forEach((k, v) -> strength.put(k.name(), v));

        Map<String, Integer> topSuperclasses = new LinkedHashMap<>();
        stats.getConceptsPerSuperclass().entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(properties.getTopSuperclasses())
                .forEach(e -> topSuperclasses.put(e.getKey(), e.getValue()));

        Map<String, String> samples = new LinkedHashMap<>();
        for (String word : properties.getSampleWords()) {
            samples.put(word, lexiconEntryRepository.findFirstByWordOrderByPriorityDesc(word)
                    .map(LexiconEntry::getCode)
                    .orElse(NOT_FOUND));
        }

        return BuildSummary.builder()
                .artifact(artifactLocation.dataFile().toString())
                .redirected(artifactLocation.redirected())
                .tablesVersion(tables.version())
                .concepts(stats.getConcepts())
                .uniqueWords(words)
                .uniqueCodes(lexiconEntryRepository.countDistinctCodes())
                .totalMappings(mappings)
                .lemmaMappings(assembly.baseForms().size())
                .antonymPairs(assembly.antonyms().size())
                .avgCodesPerWord(words == 0 ? 0.0 : (double) mappings / words)
                .fallbackConcepts(stats.getFallbackConcepts())
                .orderSensitiveConcepts(stats.getOrderSensitiveConcepts())
                .degradedConcepts(stats.getDegradedConcepts())
                .droppedSurfaceForms(stats.getDroppedSurfaceForms())
                .antonymRewrites(antonymRewrites)
                .overrideRewrites(overrideRewrites)
                .fingerprint(snapshotFingerprint.fingerprint(snapshot.entries().stream().map(LexiconRow::of).toList()))
                .valenceDistribution(valence)
                .strengthDistribution(strength)
                .topSuperclasses(topSuperclasses)
                .sampleCodes(samples)
                .build();
    }
}
