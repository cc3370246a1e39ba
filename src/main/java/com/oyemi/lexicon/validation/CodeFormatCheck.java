package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;
import com.oyemi.lexicon.model.LexiconRow;
import com.oyemi.lexicon.model.SemanticCode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Component
@Order(2)
public class CodeFormatCheck implements ValidationCheck {

    @Override
    public String name() {
        return "code-format";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        Set<String> distinct = new TreeSet<>();
        context.stored().stream().map(LexiconRow::code).forEach(distinct::add);

        List<String> issues = new ArrayList<>();
        for (String code : distinct) {
            if (!SemanticCode.isValid(code)) {
                issues.add("Invalid code format: " + code);
            }
        }
        return Checks.start(this)
                .passed(issues.isEmpty())
                .issues(Checks.capped(issues))
                .details(Map.of("distinctCodes", distinct.size(), "invalidCodes", issues.size()))
                .build();
    }
}
