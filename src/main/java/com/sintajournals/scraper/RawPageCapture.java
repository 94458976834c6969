package com.sintajournals.scraper;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Snapshot of one rendered listing page.
 * @param sequenceNumber 1-based position of the page in the crawl
 * @param markup full page markup
 * @param capturedAt capture time
 * @param origin where the markup came from (portal URL or saved file name)
 */
public record RawPageCapture(int sequenceNumber, String markup, LocalDateTime capturedAt, String origin) {

    public RawPageCapture {
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive: " + sequenceNumber);
        }
        Objects.requireNonNull(markup, "markup");
        Objects.requireNonNull(capturedAt, "capturedAt");
        origin = origin == null ? "" : origin;
    }
}
