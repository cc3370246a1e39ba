package com.oyemi.lexicon.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "oyemi.lexicon")
public class LexiconProperties {
    private boolean enabled = true;
    private RunMode mode = RunMode.BUILD;
    private String outputPath = "data/lexicon";
    private String wordnetDir = "data/wordnet/dict";
    private String sentiWordNetFile = "data/SentiWordNet_3.0.0.txt";
    private String tablesResource = "config/lexicon-tables.yaml";
    private int batchSize = 1000;
    private boolean reportEnabled = true;
    private int topSuperclasses = 15;
    private List<String> sampleWords = new ArrayList<>(List.of(
            "layoff", "fired", "happy", "sad", "worried", "fear", "angry",
            "manager", "salary", "stress", "anxiety", "love", "hate"));
    private List<String> probeWords = new ArrayList<>(List.of(
            "run", "happy", "tree", "think", "beautiful", "love",
            "computer", "music", "quickly", "dog", "house", "idea"));

    public enum RunMode {
        BUILD,
        VALIDATE
    }
}
