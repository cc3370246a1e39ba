package com.oyemi.lexicon.model;

/**
 * Sentiment polarity carried in the last field of a code.
 */
public enum Valence {
    NEUTRAL(0),
    POSITIVE(1),
    NEGATIVE(2);

    private final int digit;

    Valence(int digit) {
        this.digit = digit;
    }

    public int getDigit() {
        return digit;
    }

    public boolean isPolar() {
        return this != NEUTRAL;
    }

    /**
     * POSITIVE and NEGATIVE swap; NEUTRAL has no opposite and stays NEUTRAL.
     */
    public Valence opposite() {
        return switch (this) {
            case POSITIVE -> NEGATIVE;
            case NEGATIVE -> POSITIVE;
            case NEUTRAL -> NEUTRAL;
        };
    }

    public static Valence fromDigit(int digit) {
        for (Valence value : values()) {
            if (value.digit == digit) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown valence digit: " + digit);
    }
}
