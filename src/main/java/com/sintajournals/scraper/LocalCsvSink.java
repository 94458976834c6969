package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes the record set to {@code <output_folder>/journals_data_<timestamp>.csv} using OpenCSV.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class LocalCsvSink implements SinkWriterInterface {
    private static final Logger logger = LoggerFactory.getLogger(LocalCsvSink.class);

    private final StorageClientInterface storage;
    private final JournalSerializer serializer;

    public LocalCsvSink(StorageClientInterface storage, JournalSerializer serializer) {
        this.storage = storage;
        this.serializer = serializer;
    }

    @Override
    public String name() {
        return "local-csv";
    }

    @Override
    public boolean isRemote() {
        return false;
    }

    @Override
    public void write(List<JournalRecord> records, SinkContext context) throws SinkWriteException {
        if (records == null) {
            throw new IllegalArgumentException("Record list cannot be null");
        }
        Path target = context.config().outputFolder().resolve(context.csvFileName());
        byte[] content;
        try {
            content = serializer.toCsv(records);
        } catch (RuntimeException e) {
            throw new SinkWriteException("Could not render CSV: " + e.getMessage(), e);
        }
        if (!storage.writeLocal(target, content)) {
            throw new SinkWriteException("Could not write CSV file " + target);
        }
        logger.info("Wrote {} journals to CSV file: {}", records.size(), target);
    }
}
