package com.oyemi.lexicon.config;

import java.util.HashSet;
import java.util.Set;

/**
 * Reference ancestor sets that mark a concept as abstract or concrete. The two sets are disjoint.
 */
public final class AbstractnessAnchors {

    private final Set<String> abstractAncestors;
    private final Set<String> concreteAncestors;

    public AbstractnessAnchors(Set<String> abstractAncestors, Set<String> concreteAncestors) {
        Set<String> overlap = new HashSet<>(abstractAncestors);
        overlap.retainAll(concreteAncestors);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Abstract and concrete anchors overlap: " + overlap);
        }
        this.abstractAncestors = Set.copyOf(abstractAncestors);
        this.concreteAncestors = Set.copyOf(concreteAncestors);
    }

    public Set<String> getAbstractAncestors() {
        return abstractAncestors;
    }

    public Set<String> getConcreteAncestors() {
        return concreteAncestors;
    }
}
