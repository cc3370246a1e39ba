package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;
import com.oyemi.lexicon.dto.ValidationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every check; the lexicon passes only when all of them pass.
 */
@Service
@Slf4j
public class LexiconValidator {

    private final List<ValidationCheck> checks;

    public LexiconValidator(List<ValidationCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public ValidationReport validate(ValidationContext context) {
        List<CheckResult> results = new ArrayList<>();
        boolean passed = true;
        for (ValidationCheck check : checks) {
            CheckResult result = check.check(context);
            if (check.advisory()) {
                result.setPassed(true);
            }
            results.add(result);
            passed &= result.isPassed();
            log(result);
        }

        long words = ValidationContext.codesByWord(context.stored()).size();
        return ValidationReport.builder()
                .passed(passed)
                .words(words)
                .mappings(context.stored().size())
                .checks(results)
                .build();
    }

    private void log(CheckResult result) {
        if (!result.isPassed()) {
            log.error("Check {} FAILED with {} issue(s)", result.getName(), result.getIssues().size());
            result.getIssues().forEach(issue -> log.error("  {}", issue));
        } else if (!result.getIssues().isEmpty()) {
            log.warn("Check {} passed with {} advisory issue(s)", result.getName(), result.getIssues().size());
            result.getIssues().forEach(issue -> log.warn("  {}", issue));
        } else {
            log.info("Check {} passed", result.getName());
        }
    }
}
