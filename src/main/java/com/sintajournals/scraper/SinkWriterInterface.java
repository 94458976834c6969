package com.sintajournals.scraper;

import java.util.List;

/**
 * Interface for one persistence destination of the final record set.
 * <p>
 * Sinks are independent: the {@link PipelineOrchestrator} calls each one in turn and a failure
 * of one sink never prevents the others from writing.
 */
public interface SinkWriterInterface {
    /**
     * @return short name used in logs and statistics
     */
    String name();

    /**
     * @return true for distributed-filesystem sinks, counted separately from local ones
     */
    boolean isRemote();

    /**
     * Writes the records.
     * @param records finalized, unmodifiable record set
     * @param context run-level naming and configuration
     * @throws SinkWriteException if the destination could not be written
     */
    void write(List<JournalRecord> records, SinkContext context) throws SinkWriteException;
}
