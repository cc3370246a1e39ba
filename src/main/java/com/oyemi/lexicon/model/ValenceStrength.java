package com.oyemi.lexicon.model;

/**
 * Magnitude band of the winning sentiment score. Reported in build statistics only;
 * it never influences the stored valence digit.
 */
public enum ValenceStrength {
    STRONG,
    WEAK,
    FAINT,
    NONE
}
