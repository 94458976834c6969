package com.sintajournals.scraper;

import java.util.Optional;

/**
 * Outcome of extracting one candidate fragment: either a record or a failure reason.
 */
public record ExtractionResult(JournalRecord record, String failureReason) {

    public ExtractionResult {
        if ((record == null) == (failureReason == null)) {
            throw new IllegalArgumentException("exactly one of record and failureReason must be set");
        }
    }

    public static ExtractionResult success(JournalRecord record) {
        return new ExtractionResult(record, null);
    }

    public static ExtractionResult failure(String reason) {
        return new ExtractionResult(null, reason == null ? "unknown failure" : reason);
    }

    public boolean isSuccess() {
        return record != null;
    }

    public Optional<JournalRecord> asOptional() {
        return Optional.ofNullable(record);
    }
}
