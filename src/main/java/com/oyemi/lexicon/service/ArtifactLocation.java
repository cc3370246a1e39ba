package com.oyemi.lexicon.service;

import java.nio.file.Path;

/**
 * Where this run reads or writes the lexicon database.
 *
 * @param basePath   database path without the H2 file suffix
 * @param redirected true when the configured location could not be used
 */
public record ArtifactLocation(Path basePath, boolean redirected) {

    public static final String DATA_SUFFIX = ".mv.db";
    public static final String TRACE_SUFFIX = ".trace.db";

    public Path dataFile() {
        return sibling(DATA_SUFFIX);
    }

    public Path traceFile() {
        return sibling(TRACE_SUFFIX);
    }

    public Path reportFile() {
        return sibling("-report.json");
    }

    public String jdbcUrl() {
        return "jdbc:h2:file:" + basePath.toAbsolutePath();
    }

    private Path sibling(String suffix) {
        return basePath.resolveSibling(basePath.getFileName() + suffix);
    }
}
