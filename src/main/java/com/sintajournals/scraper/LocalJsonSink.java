package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Writes the record set with its metadata block to
 * {@code <output_folder>/journals_data_<timestamp>.json}.
 */
public class LocalJsonSink implements SinkWriterInterface {
    private static final Logger logger = LoggerFactory.getLogger(LocalJsonSink.class);

    private final StorageClientInterface storage;
    private final JournalSerializer serializer;

    public LocalJsonSink(StorageClientInterface storage, JournalSerializer serializer) {
        this.storage = storage;
        this.serializer = serializer;
    }

    @Override
    public String name() {
        return "local-json";
    }

    @Override
    public boolean isRemote() {
        return false;
    }

    @Override
    public void write(List<JournalRecord> records, SinkContext context) throws SinkWriteException {
        Path target = context.config().outputFolder().resolve(context.jsonFileName());
        byte[] content;
        try {
            content = serializer.toJson(records, context);
        } catch (RuntimeException e) {
            throw new SinkWriteException("Could not render JSON: " + e.getMessage(), e);
        }
        if (!storage.writeLocal(target, content)) {
            throw new SinkWriteException("Could not write JSON file " + target);
        }
        logger.info("Wrote {} journals to JSON file: {}", records.size(), target);
    }
}
