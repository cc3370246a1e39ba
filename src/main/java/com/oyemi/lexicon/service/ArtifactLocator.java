package com.oyemi.lexicon.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Prepares the database location before the persistence layer opens it.
 * <p>
 * A rebuild starts from nothing: an existing artifact is deleted first. When the
 * artifact cannot be removed or its directory cannot be written, the build moves
 * to a uniquely named sibling instead of failing.
 */
@Slf4j
public class ArtifactLocator {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Clock clock;

    public ArtifactLocator(Clock clock) {
        this.clock = clock;
    }

    public ArtifactLocation prepareForBuild(Path configured) {
        Path base = configured.toAbsolutePath().normalize();
        ArtifactLocation location = new ArtifactLocation(base, false);

        try {
            Files.createDirectories(base.getParent());
        } catch (IOException e) {
            log.warn("Cannot create output directory {}: {}", base.getParent(), e.getMessage());
            return redirect(inTempDir(base));
        }

        if (!Files.isWritable(base.getParent())) {
            log.warn("Output directory {} is not writable", base.getParent());
            return redirect(inTempDir(base));
        }

        try {
            if (Files.deleteIfExists(location.dataFile())) {
                log.info("Deleted existing lexicon: {}", location.dataFile());
            }
            Files.deleteIfExists(location.traceFile());
        } catch (IOException e) {
            log.warn("Cannot delete existing lexicon {} ({}), redirecting output", location.dataFile(), e.toString());
            return redirect(base);
        }
        return location;
    }

    public ArtifactLocation locateForValidation(Path configured) {
        ArtifactLocation location = new ArtifactLocation(configured.toAbsolutePath().normalize(), false);
        if (!Files.isRegularFile(location.dataFile())) {
            throw new IllegalStateException("Lexicon not found at " + location.dataFile() + "; run a build first");
        }
        return location;
    }

    private Path inTempDir(Path base) {
        return Path.of(System.getProperty("java.io.tmpdir")).resolve(base.getFileName());
    }

    private ArtifactLocation redirect(Path base) {
        String stem = base.getFileName() + "-" + LocalDateTime.now(clock).format(STAMP);
        Path candidate = base.resolveSibling(stem);
        int attempt = 1;
        while (Files.exists(new ArtifactLocation(candidate, true).dataFile())) {
            candidate = base.resolveSibling(stem + "-" + attempt++);
        }
        log.warn("Lexicon output redirected to {}", candidate);
        return new ArtifactLocation(candidate, true);
    }
}
