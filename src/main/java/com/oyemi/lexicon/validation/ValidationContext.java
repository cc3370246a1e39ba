package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.model.LexiconRow;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Inputs shared by every check.
 *
 * @param stored          rows read back from the artifact
 * @param rebuilt         rows from a fresh in-memory build over the same knowledge base
 * @param baseForms       stored word to base form mappings
 * @param probeWords      words the sample lookup reports on
 * @param topSuperclasses size of the superclass histogram
 */
public record ValidationContext(List<LexiconRow> stored,
                                List<LexiconRow> rebuilt,
                                Map<String, String> baseForms,
                                List<String> probeWords,
                                int topSuperclasses) {

    public ValidationContext {
        stored = List.copyOf(stored);
        rebuilt = List.copyOf(rebuilt);
        baseForms = Map.copyOf(baseForms);
        probeWords = List.copyOf(probeWords);
    }

    static Map<String, SortedSet<String>> codesByWord(List<LexiconRow> rows) {
        Map<String, SortedSet<String>> grouped = new TreeMap<>();
        for (LexiconRow row : rows) {
            grouped.computeIfAbsent(row.word(), k -> new TreeSet<>()).add(row.code());
        }
        return grouped;
    }

    /**
     * Highest-priority stored code of a word; ties go to the lowest code.
     */
    Optional<String> primaryCode(String word) {
        LexiconRow best = null;
        for (LexiconRow row : stored) {
            if (!row.word().equals(word)) {
                continue;
            }
            if (best == null || row.priority() > best.priority()
                    || (row.priority() == best.priority() && row.code().compareTo(best.code()) < 0)) {
                best = row;
            }
        }
        return Optional.ofNullable(best).map(LexiconRow::code);
    }
}
