package com.oyemi.lexicon.model;

/**
 * Word classes recognised by the lexicon, with the digit they occupy in a code.
 */
public enum PartOfSpeech {
    NOUN(1, 'n'),
    VERB(2, 'v'),
    ADJECTIVE(3, 'a'),
    ADVERB(4, 'r');

    private final int digit;
    private final char tag;

    PartOfSpeech(int digit, char tag) {
        this.digit = digit;
        this.tag = tag;
    }

    public int getDigit() {
        return digit;
    }

    public char getTag() {
        return tag;
    }

    /**
     * Resolve a WordNet POS letter. Satellite adjectives ('s') fold into ADJECTIVE.
     */
    public static PartOfSpeech fromTag(char tag) {
        return switch (Character.toLowerCase(tag)) {
            case 'n' -> NOUN;
            case 'v' -> VERB;
            case 'a', 's' -> ADJECTIVE;
            case 'r' -> ADVERB;
            default -> throw new IllegalArgumentException("Unknown part-of-speech tag: " + tag);
        };
    }

    public static PartOfSpeech fromDigit(int digit) {
        for (PartOfSpeech pos : values()) {
            if (pos.digit == digit) {
                return pos;
            }
        }
        throw new IllegalArgumentException("Unknown part-of-speech digit: " + digit);
    }
}
