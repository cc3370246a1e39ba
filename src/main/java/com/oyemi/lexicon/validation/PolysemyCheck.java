package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Histogram of words by number of senses, plus the most polysemous words.
 */
@Component
@Order(5)
public class PolysemyCheck implements ValidationCheck {

    static final int MOST_POLYSEMOUS = 10;

    @Override
    public String name() {
        return "polysemy";
    }

    @Override
    public boolean advisory() {
        return true;
    }

    @Override
    public CheckResult check(ValidationContext context) {
        Map<String, SortedSet<String>> byWord = ValidationContext.codesByWord(context.stored());

        Map<Integer, Integer> histogram = new TreeMap<>();
        byWord.values().forEach(codes -> histogram.merge(codes.size(), 1, Integer::sum));

        Map<String, Integer> mostPolysemous = new LinkedHashMap<>();
        byWord.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, SortedSet<String>>>comparingInt(e -> e.getValue().size())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(MOST_POLYSEMOUS)
                .forEach(e -> mostPolysemous.put(e.getKey(), e.getValue().size()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("sensesPerWord", histogram);
        details.put("mostPolysemous", mostPolysemous);
        return Checks.start(this)
                .passed(true)
                .details(details)
                .build();
    }
}
