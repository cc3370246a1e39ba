package com.oyemi.lexicon.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Composite classification code {@code HHHH-LLLLL-P-A-V}.
 * <p>
 * HHHH is the superclass, LLLLL the per-superclass sequence number, P the part of
 * speech, A the abstractness and V the valence. The string form is the contract
 * every downstream consumer reads, so {@link #parse(String)} rejects anything that
 * does not match {@link #PATTERN} exactly.
 */
public record SemanticCode(String superclass,
                           int localSequence,
                           PartOfSpeech pos,
                           Abstractness abstractness,
                           Valence valence) {

    public static final Pattern PATTERN = Pattern.compile("^(\\d{4})-(\\d{5})-([1-4])-([0-2])-([0-2])$");

    private static final Pattern SUPERCLASS = Pattern.compile("\\d{4}");
    private static final int MAX_SEQUENCE = 99_999;

    public SemanticCode {
        if (superclass == null || !SUPERCLASS.matcher(superclass).matches()) {
            throw new IllegalArgumentException("Superclass must be four digits: " + superclass);
        }
        if (localSequence < 0 || localSequence > MAX_SEQUENCE) {
            throw new IllegalArgumentException("Local sequence out of range: " + localSequence);
        }
        if (pos == null || abstractness == null || valence == null) {
            throw new IllegalArgumentException("Code fields must not be null");
        }
    }

    public static SemanticCode parse(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Code must not be null");
        }
        Matcher matcher = PATTERN.matcher(code);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid code format: " + code);
        }
        return new SemanticCode(
                matcher.group(1),
                Integer.parseInt(matcher.group(2)),
                PartOfSpeech.fromDigit(Integer.parseInt(matcher.group(3))),
                Abstractness.fromDigit(Integer.parseInt(matcher.group(4))),
                Valence.fromDigit(Integer.parseInt(matcher.group(5))));
    }

    public static boolean isValid(String code) {
        return code != null && PATTERN.matcher(code).matches();
    }

    public SemanticCode withValence(Valence newValence) {
        return new SemanticCode(superclass, localSequence, pos, abstractness, newValence);
    }

    public String format() {
        return String.format("%s-%05d-%d-%d-%d",
                superclass, localSequence, pos.getDigit(), abstractness.getDigit(), valence.getDigit());
    }

    @Override
    public String toString() {
        return format();
    }
}
