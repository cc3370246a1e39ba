package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;
import com.oyemi.lexicon.model.LexiconRow;
import com.oyemi.lexicon.model.SemanticCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rows per superclass, reported as the top N plus the number of superclasses in use.
 */
@Component
@Order(4)
public class SuperclassDistributionCheck implements ValidationCheck {

    @Override
    public String name() {
        return "superclass-distribution";
    }

    @Override
    public boolean advisory() {
        return true;
    }

    @Override
    public CheckResult check(ValidationContext context) {
        Map<String, Integer> counts = new TreeMap<>();
        for (LexiconRow row : context.stored()) {
            if (SemanticCode.isValid(row.code())) {
                counts.merge(row.code().substring(0, 4), 1, Integer::sum);
            }
        }

        Map<String, Integer> top = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(context.topSuperclasses())
                .forEach(e -> top.put(e.getKey(), e.getValue()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalSuperclasses", counts.size());
        details.put("top", top);
        return Checks.start(this)
                .passed(true)
                .details(details)
                .build();
    }
}
