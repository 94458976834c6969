package com.sintajournals.scraper;

import java.util.List;

/**
 * Result of transforming one capture.
 * @param sequenceNumber capture sequence number
 * @param records extracted records in document order
 * @param pageErrors human-readable failure descriptions in document order
 * @param candidateCount number of candidate fragments found
 * @param failedCount number of candidates that failed extraction
 * @param parseFailed true when the page markup itself could not be parsed
 */
public record PageReport(
    int sequenceNumber,
    List<JournalRecord> records,
    List<String> pageErrors,
    int candidateCount,
    int failedCount,
    boolean parseFailed
) {
    public PageReport {
        records = List.copyOf(records);
        pageErrors = List.copyOf(pageErrors);
    }

    static PageReport parseFailure(int sequenceNumber, String error) {
        return new PageReport(sequenceNumber, List.of(), List.of(error), 0, 0, true);
    }

    public int successCount() {
        return records.size();
    }
}
