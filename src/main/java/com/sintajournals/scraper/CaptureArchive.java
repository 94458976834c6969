package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves each crawled page as {@code sinta_journals_page<N>_<timestamp>.html} so that the
 * captures can be transformed again later by {@link FolderCaptureSource}.
 */
public class CaptureArchive {
    private static final Logger logger = LoggerFactory.getLogger(CaptureArchive.class);

    private final Path folder;

    public CaptureArchive(Path folder) {
        this.folder = folder;
    }

    /**
     * Writes the capture markup as UTF-8.
     * @return path of the written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path save(RawPageCapture capture) {
        String filename = String.format("sinta_journals_page%d_%s.html",
            capture.sequenceNumber(), Utils.fileTimestamp(capture.capturedAt()));
        Path target = folder.resolve(filename);
        try {
            Files.createDirectories(folder);
            Files.writeString(target, capture.markup(), StandardCharsets.UTF_8);
            logger.info("Saved page {} HTML to {}", capture.sequenceNumber(), target);
            return target;
        } catch (IOException e) {
            logger.error("Failed to save page {} HTML to {}: {}", capture.sequenceNumber(), target, e.getMessage());
            throw new UncheckedIOException("Failed to save " + target, e);
        }
    }

    public Path getFolder() {
        return folder;
    }
}
