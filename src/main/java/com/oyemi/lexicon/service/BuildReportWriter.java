package com.oyemi.lexicon.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.oyemi.lexicon.dto.LexiconReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the build and validation outcome as JSON beside the artifact.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BuildReportWriter {

    private final ObjectMapper objectMapper;

    /**
     * @return false when the report could not be written; the build result itself is unaffected
     */
    public boolean write(LexiconReport report, Path target) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
            log.info("Wrote report to {}", target);
            return true;
        } catch (IOException e) {
            log.warn("Failed to write report to {}: {}", target, e.getMessage());
            return false;
        }
    }
}
