package com.oyemi.lexicon.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one lexicon build.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildSummary {

    /**
     * Database file actually written
     */
    private String artifact;

    /**
     * True when the configured location was unusable and output went elsewhere
     */
    private boolean redirected;

    private String tablesVersion;

    private int concepts;
    private long uniqueWords;
    private long uniqueCodes;
    private long totalMappings;
    private int lemmaMappings;
    private int antonymPairs;
    private double avgCodesPerWord;

    /**
     * Concepts that fell back to a part-of-speech superclass
     */
    private int fallbackConcepts;

    /**
     * Concepts whose superclass would differ if hypernym paths were compared by closeness
     */
    private int orderSensitiveConcepts;

    /**
     * Concepts encoded with defaults after a traversal, sentiment or hierarchy failure
     */
    private int degradedConcepts;

    private int droppedSurfaceForms;
    private int antonymRewrites;
    private int overrideRewrites;

    /**
     * SHA-256 over the sorted (word, code, priority) rows
     */
    private String fingerprint;

    @Builder.Default
    private Map<String, Integer> valenceDistribution = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> strengthDistribution = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> topSuperclasses = new LinkedHashMap<>();

    /**
     * Primary code per sample word, or NOT FOUND
     */
    @Builder.Default
    private Map<String, String> sampleCodes = new LinkedHashMap<>();
}
