package com.oyemi.lexicon.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    /**
     * Logical AND of every check
     */
    private boolean passed;

    private long words;

    private long mappings;

    @Builder.Default
    private List<CheckResult> checks = new ArrayList<>();

    public List<String> allIssues() {
        List<String> issues = new ArrayList<>();
        checks.forEach(check -> issues.addAll(check.getIssues()));
        return issues;
    }
}
