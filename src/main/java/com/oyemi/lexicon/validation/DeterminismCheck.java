package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;
import com.oyemi.lexicon.model.LexiconRow;
import com.oyemi.lexicon.service.SnapshotFingerprint;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Stored word to code sets must equal those of a fresh rebuild, and no (word, code) may repeat.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class DeterminismCheck implements ValidationCheck {

    private final SnapshotFingerprint snapshotFingerprint;

    @Override
    public String name() {
        return "determinism";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        List<String> issues = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        for (LexiconRow row : context.stored()) {
            if (!seen.add(row.word() + '\t' + row.code())) {
                issues.add("Duplicate mapping: '" + row.word() + "' -> " + row.code());
            }
        }

        Map<String, SortedSet<String>> stored = ValidationContext.codesByWord(context.stored());
        Map<String, SortedSet<String>> rebuilt = ValidationContext.codesByWord(context.rebuilt());
        Set<String> words = new TreeSet<>(stored.keySet());
        words.addAll(rebuilt.keySet());
        int unstableWords = 0;
        for (String word : words) {
            SortedSet<String> before = stored.getOrDefault(word, new TreeSet<>());
            SortedSet<String> after = rebuilt.getOrDefault(word, new TreeSet<>());
            if (!before.equals(after)) {
                unstableWords++;
                issues.add("Codes for '" + word + "' differ: stored " + before + ", rebuilt " + after);
            }
        }

        String storedFingerprint = snapshotFingerprint.fingerprint(context.stored());
        String rebuiltFingerprint = snapshotFingerprint.fingerprint(context.rebuilt());
        boolean fingerprintsMatch = storedFingerprint.equals(rebuiltFingerprint);
        if (!fingerprintsMatch && unstableWords == 0) {
            issues.add("Fingerprint mismatch with identical code sets: priorities differ");
        }

        return Checks.start(this)
                .passed(issues.isEmpty())
                .issues(Checks.capped(issues))
                .details(Map.of(
                        "storedFingerprint", storedFingerprint,
                        "rebuiltFingerprint", rebuiltFingerprint,
                        "unstableWords", unstableWords))
                .build();
    }
}
