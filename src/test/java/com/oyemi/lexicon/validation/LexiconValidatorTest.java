package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;
import com.oyemi.lexicon.dto.ValidationReport;
import com.oyemi.lexicon.model.LexiconRow;
import com.oyemi.lexicon.service.SnapshotFingerprint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LexiconValidatorTest {

    private static final List<LexiconRow> ROWS = List.of(
            new LexiconRow("happy", "3010-00001-3-2-1", 10_050),
            new LexiconRow("sad", "3011-00001-3-2-2", 10_040),
            new LexiconRow("run", "2000-00001-2-1-0", 10_060),
            new LexiconRow("run", "0200-00004-1-2-0", 10_020),
            new LexiconRow("dog", "0013-00001-1-0-0", 10_030),
            new LexiconRow("quickly", "4999-00001-4-1-0", 12));

    private LexiconValidator validator;

    @BeforeEach
    void setUp() {
        validator = new LexiconValidator(List.of(
                new DeterminismCheck(new SnapshotFingerprint()),
                new CodeFormatCheck(),
                new PosDistributionCheck(),
                new SuperclassDistributionCheck(),
                new PolysemyCheck(),
                new SampleLookupCheck()));
    }

    private static ValidationContext context(List<LexiconRow> stored, List<LexiconRow> rebuilt, List<String> probes) {
        return new ValidationContext(stored, rebuilt, Map.of("ran", "run"), probes, 3);
    }

    private static CheckResult result(ValidationReport report, String name) {
        return report.getChecks().stream().filter(c -> c.getName().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void testConsistentLexiconPasses() {
        ValidationReport report = validator.validate(context(ROWS, ROWS, List.of("happy", "ran")));

        assertTrue(report.isPassed());
        assertEquals(5, report.getWords());
        assertEquals(6, report.getMappings());
        assertEquals(6, report.getChecks().size());
        assertEquals("2000-00001-2-1-0", result(report, "sample-lookups").getDetails().get("ran"));
    }

    @Test
    void testCodeSetDifferenceFailsDeterminism() {
        List<LexiconRow> rebuilt = new ArrayList<>(ROWS);
        rebuilt.set(1, new LexiconRow("sad", "3011-00001-3-2-0", 10_040));

        ValidationReport report = validator.validate(context(ROWS, rebuilt, List.of()));

        assertFalse(report.isPassed());
        CheckResult determinism = result(report, "determinism");
        assertFalse(determinism.isPassed());
        assertEquals(1, determinism.getIssues().size());
        assertTrue(determinism.getIssues().get(0).contains("'sad'"));
    }

    @Test
    void testPriorityDriftFailsDeterminism() {
        List<LexiconRow> rebuilt = new ArrayList<>(ROWS);
        rebuilt.set(0, new LexiconRow("happy", "3010-00001-3-2-1", 1));

        ValidationReport report = validator.validate(context(ROWS, rebuilt, List.of()));

        assertFalse(result(report, "determinism").isPassed());
    }

    @Test
    void testDuplicateStoredMappingFailsDeterminism() {
        List<LexiconRow> stored = new ArrayList<>(ROWS);
        stored.add(new LexiconRow("dog", "0013-00001-1-0-0", 10_030));

        ValidationReport report = validator.validate(context(stored, ROWS, List.of()));

        assertTrue(result(report, "determinism").getIssues().get(0).startsWith("Duplicate mapping"));
        assertFalse(report.isPassed());
    }

    @Test
    void testMalformedCodeFailsFormat() {
        List<LexiconRow> stored = new ArrayList<>(ROWS);
        stored.add(new LexiconRow("odd", "233-1-1-2-2", 5));

        ValidationReport report = validator.validate(context(stored, stored, List.of()));

        assertFalse(report.isPassed());
        assertEquals(List.of("Invalid code format: 233-1-1-2-2"), result(report, "code-format").getIssues());
        assertEquals(1, result(report, "pos-distribution").getDetails().get(PosDistributionCheck.UNPARSEABLE));
    }

    @Test
    void testMissingProbeWordIsAdvisoryOnly() {
        ValidationReport report = validator.validate(context(ROWS, ROWS, List.of("computer")));

        assertTrue(report.isPassed());
        CheckResult lookups = result(report, "sample-lookups");
        assertTrue(lookups.isAdvisory());
        assertEquals(List.of("Word not found: computer"), lookups.getIssues());
        assertEquals(List.of("Word not found: computer"), report.allIssues());
    }

    @Test
    void testDistributions() {
        ValidationReport report = validator.validate(context(ROWS, ROWS, List.of()));

        Map<String, Object> pos = result(report, "pos-distribution").getDetails();
        assertEquals(2, pos.get("NOUN"));
        assertEquals(1, pos.get("VERB"));
        assertEquals(2, pos.get("ADJECTIVE"));
        assertEquals(6, result(report, "superclass-distribution").getDetails().get("totalSuperclasses"));

        Map<?, ?> sensesPerWord = (Map<?, ?>) result(report, "polysemy").getDetails().get("sensesPerWord");
        assertEquals(4, sensesPerWord.get(1));
        assertEquals(1, sensesPerWord.get(2));
    }

    @Test
    void testIssueListIsCapped() {
        List<LexiconRow> stored = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            stored.add(new LexiconRow("w" + i, "bad-" + i, 1));
        }

        CheckResult format = new CodeFormatCheck().check(context(stored, stored, List.of()));

        assertEquals(Checks.MAX_REPORTED_ISSUES + 1, format.getIssues().size());
        assertEquals("... and 10 more", format.getIssues().get(Checks.MAX_REPORTED_ISSUES));
    }

    @Test
    void testLookupLowercasesIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ValidationReport report = validator.validate(context(ROWS, ROWS, List.of("QUICKLY")));

            CheckResult lookups = result(report, "sample-lookups");
            assertTrue(lookups.getIssues().isEmpty());
            assertEquals("4999-00001-4-1-0", lookups.getDetails().get("quickly"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
