package com.oyemi.lexicon.config;

/**
 * The curated tables one build runs against.
 */
public record LexiconTables(String version,
                            SuperclassTable superclasses,
                            AbstractnessAnchors anchors,
                            ValenceOverrides overrides) {
}
