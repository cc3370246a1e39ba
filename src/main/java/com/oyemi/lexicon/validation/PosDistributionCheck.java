package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;
import com.oyemi.lexicon.model.LexiconRow;
import com.oyemi.lexicon.model.PartOfSpeech;
import com.oyemi.lexicon.model.SemanticCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@Order(3)
public class PosDistributionCheck implements ValidationCheck {

    static final String UNPARSEABLE = "UNPARSEABLE";

    @Override
    public String name() {
        return "pos-distribution";
    }

    @Override
    public boolean advisory() {
        return true;
    }

    @Override
    public CheckResult check(ValidationContext context) {
        Map<String, Object> histogram = new LinkedHashMap<>();
        for (PartOfSpeech pos : PartOfSpeech.values()) {
            histogram.put(pos.name(), 0);
        }
        int unparseable = 0;
        for (LexiconRow row : context.stored()) {
            if (!SemanticCode.isValid(row.code())) {
                unparseable++;
                continue;
            }
            String pos = SemanticCode.parse(row.code()).pos().name();
            histogram.put(pos, (Integer) histogram.get(pos) + 1);
        }

        List<String> issues = new ArrayList<>();
        for (PartOfSpeech pos : PartOfSpeech.values()) {
            if ((Integer) histogram.get(pos.name()) == 0) {
                issues.add("No entries for " + pos.name().toLowerCase());
            }
        }
        if (unparseable > 0) {
            histogram.put(UNPARSEABLE, unparseable);
        }
        return Checks.start(this)
                .passed(true)
                .issues(issues)
                .details(histogram)
                .build();
    }
}
