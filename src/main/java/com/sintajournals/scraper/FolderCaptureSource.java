package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Re-reads archived listing pages ({@code *.html}) from a folder as captures.
 * <p>
 * Files are ordered by the page number embedded in names such as
 * {@code sinta_journals_page12_20250104_153012.html}, then by name, so page 10 follows page 9.
 * Names without a page number, or with one too large for a {@code long}, sort last.
 * Sequence numbers are assigned 1..N in that order. Unreadable files are reported and skipped.
 */
public class FolderCaptureSource implements CaptureSourceInterface {
    private static final Logger logger = LoggerFactory.getLogger(FolderCaptureSource.class);
    private static final Pattern PAGE_NUMBER = Pattern.compile("page(\\d+)");

    private final Path folder;

    public FolderCaptureSource(Path folder) {
        this.folder = folder;
    }

    @Override
    public String describe() {
        return folder.toString();
    }

    @Override
    public CaptureBatch readCaptures() {
        logger.info("Reading saved pages from folder: {}", folder);
        List<String> errors = new ArrayList<>();
        List<Path> files;
        if (!Files.isDirectory(folder)) {
            logger.warn("Input folder {} does not exist", folder);
            return new CaptureBatch(List.of(), false, List.of());
        }
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing
                .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".html"))
                .sorted(pageOrder())
                .collect(Collectors.toList());
        } catch (IOException e) {
            String error = "Error listing " + folder + ": " + e.getMessage();
            logger.error(error);
            return new CaptureBatch(List.of(), false, List.of(error));
        }
        if (files.isEmpty()) {
            logger.warn("No HTML files found in {}", folder);
            return new CaptureBatch(List.of(), false, List.of());
        }
        logger.info("Found {} HTML files", files.size());

        List<RawPageCapture> captures = new ArrayList<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                String markup = Files.readString(file, StandardCharsets.UTF_8);
                LocalDateTime modified = LocalDateTime.ofInstant(Files.getLastModifiedTime(file).toInstant(), ZoneId.systemDefault());
                captures.add(new RawPageCapture(captures.size() + 1, markup, modified, name));
                logger.debug("Loaded {}", name);
            } catch (IOException | RuntimeException e) {
                String error = "Error reading " + name + ": " + e.getMessage();
                logger.error(error);
                errors.add(error);
            }
        }
        return new CaptureBatch(captures, false, errors);
    }

    static Comparator<Path> pageOrder() {
        return Comparator
            .comparingLong((Path p) -> pageNumber(p.getFileName().toString()))
            .thenComparing(p -> p.getFileName().toString());
    }

    private static long pageNumber(String name) {
        Matcher m = PAGE_NUMBER.matcher(name);
        if (!m.find()) return Long.MAX_VALUE;
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            logger.debug("Page number out of range in {}", name);
            return Long.MAX_VALUE;
        }
    }
}
