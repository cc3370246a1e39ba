package com.oyemi.lexicon.init;

import com.oyemi.lexicon.config.LexiconProperties;
import com.oyemi.lexicon.dto.BuildSummary;
import com.oyemi.lexicon.dto.LexiconReport;
import com.oyemi.lexicon.dto.ValidationReport;
import com.oyemi.lexicon.service.ArtifactLocation;
import com.oyemi.lexicon.service.BuildReportWriter;
import com.oyemi.lexicon.service.LexiconBuildService;
import com.oyemi.lexicon.validation.ValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one build or validation at start-up. The exit code is 1 when validation fails.
 */
@Component
@ConditionalOnProperty(prefix = "oyemi.lexicon", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LexiconBuildRunner implements CommandLineRunner, ExitCodeGenerator {

    private final LexiconProperties properties;
    private final LexiconBuildService buildService;
    private final ValidationService validationService;
    private final BuildReportWriter reportWriter;
    private final ArtifactLocation artifactLocation;

    private int exitCode;

    @Override
    public void run(String... args) {
        log.info("Lexicon run mode: {}", properties.getMode());

        BuildSummary summary = null;
        if (properties.getMode() == LexiconProperties.RunMode.BUILD) {
            summary = buildService.build();
            logSummary(summary);
        }

        ValidationReport validation = validationService.validate();
        exitCode = validation.isPassed() ? 0 : 1;

        if (properties.isReportEnabled()) {
            reportWriter.write(new LexiconReport(summary, validation), artifactLocation.reportFile());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void logSummary(BuildSummary summary) {
        log.info("Artifact: {}{}", summary.getArtifact(), summary.isRedirected() ? " (redirected)" : "");
        log.info("Concepts: {} ({} fallback, {} order-sensitive, {} degraded)",
                summary.getConcepts(), summary.getFallbackConcepts(), summary.getOrderSensitiveConcepts(),
                summary.getDegradedConcepts());
        log.info("Words: {}, codes: {}, mappings: {}, avg codes/word: {}",
                summary.getUniqueWords(), summary.getUniqueCodes(), summary.getTotalMappings(),
                String.format("%.2f", summary.getAvgCodesPerWord()));
        log.info("Base forms: {}, antonym pairs: {}, dropped surface forms: {}",
                summary.getLemmaMappings(), summary.getAntonymPairs(), summary.getDroppedSurfaceForms());
        log.info("Antonym rewrites: {}, override rewrites: {}",
                summary.getAntonymRewrites(), summary.getOverrideRewrites());
        log.info("Valence: {}", summary.getValenceDistribution());
        log.info("Lexical strength: {}", summary.getStrengthDistribution());
        log.info("Top superclasses: {}", summary.getTopSuperclasses());
        summary.getSampleCodes().forEach((word, code) -> log.info("  {} -> {}", word, code));
        log.info("Fingerprint: {}", summary.getFingerprint());
    }
}
