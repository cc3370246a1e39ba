package com.oyemi.lexicon.service;

import com.oyemi.lexicon.model.Abstractness;
import com.oyemi.lexicon.model.AntonymLink;
import com.oyemi.lexicon.model.Concept;
import com.oyemi.lexicon.model.EncodedSense;
import com.oyemi.lexicon.model.Lemma;
import com.oyemi.lexicon.model.LexiconSnapshot;
import com.oyemi.lexicon.model.SemanticCode;
import com.oyemi.lexicon.model.Valence;
import com.oyemi.lexicon.source.BaseFormResolver;
import com.oyemi.lexicon.source.KnowledgeBase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Encoding pass: visits every concept once and produces one row per acceptable lemma.
 * <p>
 * Superclass, abstractness and lexical valence are decided per concept; the
 * override table is applied per surface word on top of the lexical valence. The
 * sequence number of a concept is taken from its superclass counter in visitation
 * order, so two passes over the same knowledge base produce identical rows.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LexiconAssembler {

    private final HierarchyResolver hierarchyResolver;
    private final AbstractnessClassifier abstractnessClassifier;
    private final ValenceResolver valenceResolver;
    private final PriorityRanker priorityRanker;
    private final CodeEncoder codeEncoder;

    public AssemblyResult assemble(KnowledgeBase knowledgeBase, BaseFormResolver baseFormResolver) {
        CodeEncoder.SequenceCounter counter = codeEncoder.newCounter();
        AssemblyStats stats = new AssemblyStats();
        List<EncodedSense> senses = new ArrayList<>();
        Map<String, String> baseForms = new LinkedHashMap<>();
        Set<AntonymLink> antonyms = new LinkedHashSet<>();

        try (Stream<Concept> concepts = knowledgeBase.concepts()) {
            Iterator<Concept> iterator = concepts.iterator();
            while (iterator.hasNext()) {
                Concept concept = iterator.next();

                SuperclassAssignment superclass = hierarchyResolver.resolve(concept);
                int localSequence = counter.next(superclass.code());
                Abstractness abstractness = abstractnessClassifier.classify(concept);
                Valence lexical = valenceResolver.lexical(concept.sentiment());
                stats.recordConcept(superclass, lexical, valenceResolver.strength(concept.sentiment()));
                if (concept.degraded() || superclass.degraded()) {
                    stats.recordDegradedConcept();
                }

                for (Lemma lemma : concept.lemmas()) {
                    String word = SurfaceForms.normalize(lemma.name());
                    if (!SurfaceForms.isAcceptable(word)) {
                        stats.recordDroppedSurfaceForm();
                        log.debug("Dropping surface form '{}' of {}", lemma.name(), concept.id());
                        continue;
                    }

                    Valence valence = valenceResolver.override(word).orElse(lexical);
                    SemanticCode code = codeEncoder.encode(superclass.code(), localSequence,
                            concept.pos(), abstractness, valence);
                    long priority = priorityRanker.rank(lemma.frequency(), superclass.specific(), lemma.ordinal());
                    senses.add(new EncodedSense(word, code, priority));

                    if (SurfaceForms.isSingleToken(word)) {
                        String base = baseFormResolver.baseForm(word);
                        if (base != null && !base.equals(word)) {
                            baseForms.put(word, base);
                        }
                    }

                    for (String antonymName : lemma.antonyms()) {
                        String antonym = SurfaceForms.normalize(antonymName);
                        if (SurfaceForms.isAcceptable(antonym) && !antonym.equals(word)) {
                            antonyms.add(new AntonymLink(word, antonym).canonical());
                        }
                    }
                }
            }
        }

        LexiconSnapshot snapshot = LexiconSnapshot.of(senses);
        log.info("Encoded {} concepts into {} rows ({} fallback superclasses, {} degraded, {} surface forms dropped)",
                stats.getConcepts(), snapshot.size(), stats.getFallbackConcepts(), stats.getDegradedConcepts(),
                stats.getDroppedSurfaceForms());
        return new AssemblyResult(snapshot, baseForms, new ArrayList<>(antonyms), stats);
    }
}
