package com.oyemi.lexicon.model;

import java.util.List;

/**
 * One chain of concept identifiers, ordered from the concept itself outward to a root.
 */
public record HypernymPath(List<String> ancestors) {

    public HypernymPath {
        ancestors = List.copyOf(ancestors);
    }

    public static HypernymPath of(String... ancestors) {
        return new HypernymPath(List.of(ancestors));
    }
}
