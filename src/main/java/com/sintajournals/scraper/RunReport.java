package com.sintajournals.scraper;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Final outcome of one pipeline run.
 * @param status how far the run got
 * @param aborted true when the capture source stopped on an unrecoverable failure
 * @param recordCount number of records handed to the sinks
 * @param statistics finalized statistics
 * @param statisticsFile path of the statistics artifact, or null if it could not be written
 * @param duration wall-clock duration of the run
 */
public record RunReport(
    Status status,
    boolean aborted,
    int recordCount,
    RunStatistics statistics,
    Path statisticsFile,
    Duration duration
) {
    public enum Status {
        /** Records were extracted and every configured sink was attempted. */
        COMPLETED,
        /** No pages were captured; nothing was written. */
        NO_INPUT,
        /** Pages were captured but no record was extracted; nothing was written. */
        NO_RECORDS
    }

    /**
     * @return true when the run ended normally and every sink succeeded
     */
    public boolean isClean() {
        return status == Status.COMPLETED && !aborted
            && statistics.getSinkFailures() == 0 && statistics.getHdfsFailures() == 0;
    }
}
