package com.oyemi.lexicon.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.oyemi.lexicon.dto.BuildSummary;
import com.oyemi.lexicon.dto.LexiconReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BuildReportWriterTest {

    @TempDir
    Path tempDir;

    private static LexiconReport report() {
        return new LexiconReport(BuildSummary.builder().concepts(4).uniqueWords(3).build(), null);
    }

    @Test
    void testWritesIndentedJsonWithInjectedMapper() throws IOException {
        ObjectMapper mapper = new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        BuildReportWriter writer = new BuildReportWriter(mapper);
        Path target = tempDir.resolve("lexicon-report.json");

        assertTrue(writer.write(report(), target));

        String json = Files.readString(target);
        assertTrue(json.contains("\"unique_words\" : 3"));
        assertTrue(json.lines().count() > 1);
    }

    @Test
    void testUnwritableTargetReturnsFalse() {
        BuildReportWriter writer = new BuildReportWriter(new ObjectMapper());

        assertFalse(writer.write(report(), tempDir.resolve("missing").resolve("report.json")));
    }
}
