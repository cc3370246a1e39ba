package com.oyemi.lexicon.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON document written next to the artifact.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LexiconReport {
    private BuildSummary build;
    private ValidationReport validation;
}
