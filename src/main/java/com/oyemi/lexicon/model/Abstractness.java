package com.oyemi.lexicon.model;

public enum Abstractness {
    CONCRETE(0),
    MIXED(1),
    ABSTRACT(2);

    private final int digit;

    Abstractness(int digit) {
        this.digit = digit;
    }

    public int getDigit() {
        return digit;
    }

    public static Abstractness fromDigit(int digit) {
        for (Abstractness value : values()) {
            if (value.digit == digit) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown abstractness digit: " + digit);
    }
}
