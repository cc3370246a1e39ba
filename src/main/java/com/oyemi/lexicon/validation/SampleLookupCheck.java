package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the primary code of each probe word, retrying with its stored base form.
 */
@Component
@Order(6)
public class SampleLookupCheck implements ValidationCheck {

    @Override
    public String name() {
        return "sample-lookups";
    }

    @Override
    public boolean advisory() {
        return true;
    }

    @Override
    public CheckResult check(ValidationContext context) {
        Map<String, Object> found = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        for (String probe : context.probeWords()) {
            String word = probe.toLowerCase(Locale.ROOT).trim();
            Optional<String> code = context.primaryCode(word);
            if (code.isEmpty() && context.baseForms().containsKey(word)) {
                code = context.primaryCode(context.baseForms().get(word));
            }
            if (code.isPresent()) {
                found.put(word, code.get());
            } else {
                issues.add("Word not found: " + word);
            }
        }
        return Checks.start(this)
                .passed(true)
                .issues(issues)
                .details(found)
                .build();
    }
}
