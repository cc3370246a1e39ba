package com.oyemi.lexicon.service;

/**
 * Outcome of hierarchy resolution for one concept.
 *
 * @param code             four-digit superclass code
 * @param specific         true when a table entry matched, false for a part-of-speech fallback
 * @param matchedAncestor  the ancestor whose entry matched, or null for a fallback
 * @param orderSensitive   true when a later hypernym path holds a closer match with a different code
 * @param degraded         true when hierarchy traversal failed and the fallback was forced
 */
public record SuperclassAssignment(String code, boolean specific, String matchedAncestor, boolean orderSensitive,
                                  boolean degraded) {

    public static SuperclassAssignment fallback(String code) {
        return new SuperclassAssignment(code, false, null, false, false);
    }

    public static SuperclassAssignment degraded(String code) {
        return new SuperclassAssignment(code, false, null, false, true);
    }
}
