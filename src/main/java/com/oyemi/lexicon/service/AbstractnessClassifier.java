package com.oyemi.lexicon.service;

import com.oyemi.lexicon.config.AbstractnessAnchors;
import com.oyemi.lexicon.model.Abstractness;
import com.oyemi.lexicon.model.Concept;
import com.oyemi.lexicon.model.HypernymPath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;

/**
 * Classifies a concept as concrete, abstract or mixed from the union of its ancestors over all paths.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AbstractnessClassifier {

    private final AbstractnessAnchors anchors;

    public Abstractness classify(Concept concept) {
        try {
            Set<String> ancestors = new HashSet<>();
            for (HypernymPath path : concept.paths()) {
                ancestors.addAll(path.ancestors());
            }

            boolean isAbstract = intersects(ancestors, anchors.getAbstractAncestors());
            boolean isConcrete = intersects(ancestors, anchors.getConcreteAncestors());

            if (isConcrete && !isAbstract) {
                return Abstractness.CONCRETE;
            }
            if (isAbstract && !isConcrete) {
                return Abstractness.ABSTRACT;
            }
        } catch (RuntimeException e) {
            log.debug("Abstractness lookup failed for {}: {}", concept.id(), e.getMessage());
        }
        return Abstractness.MIXED;
    }

    private boolean intersects(Set<String> ancestors, Set<String> anchorSet) {
        for (String anchor : anchorSet) {
            if (ancestors.contains(anchor)) {
                return true;
            }
        }
        return false;
    }
}
