package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;

import java.util.ArrayList;
import java.util.List;

final class Checks {

    static final int MAX_REPORTED_ISSUES = 20;

    private Checks() {
    }

    /**
     * Caps the issue list so a badly broken artifact still yields a readable report.
     */
    static List<String> capped(List<String> issues) {
        if (issues.size() <= MAX_REPORTED_ISSUES) {
            return issues;
        }
        List<String> kept = new ArrayList<>(issues.subList(0, MAX_REPORTED_ISSUES));
        kept.add("... and " + (issues.size() - MAX_REPORTED_ISSUES) + " more");
        return kept;
    }

    static CheckResult.CheckResultBuilder start(ValidationCheck check) {
        return CheckResult.builder().name(check.name()).advisory(check.advisory());
    }
}
