package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Uploads the record set to HDFS under {@code <hdfs_path>/<YYYY>/<MM>/<DD>/}.
 * <p>
 * The date-partitioned directory is created first. Then every format selected by the
 * configured output format (CSV, JSON or both) is uploaded. The sink fails if the directory
 * cannot be created or if any upload fails; uploads that can still run are attempted anyway.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class HdfsSink implements SinkWriterInterface {
    private static final Logger logger = LoggerFactory.getLogger(HdfsSink.class);

    private final StorageClientInterface storage;
    private final JournalSerializer serializer;

    public HdfsSink(StorageClientInterface storage, JournalSerializer serializer) {
        this.storage = storage;
        this.serializer = serializer;
    }

    @Override
    public String name() {
        return "hdfs";
    }

    @Override
    public boolean isRemote() {
        return true;
    }

    @Override
    public void write(List<JournalRecord> records, SinkContext context) throws SinkWriteException {
        RunConfig config = context.config();
        String directory = Utils.datePartition(config.hdfsPath(), context.runTimestamp());
        if (!storage.ensureRemoteDir(directory)) {
            throw new SinkWriteException("Could not create HDFS directory " + directory);
        }

        List<String> failed = new ArrayList<>();
        try {
            if (config.outputFormat().includesCsv()) {
                upload(directory + "/" + context.csvFileName(), serializer.toCsv(records), failed);
            }
            if (config.outputFormat().includesJson()) {
                upload(directory + "/" + context.jsonFileName(), serializer.toJson(records, context), failed);
            }
        } catch (RuntimeException e) {
            throw new SinkWriteException("Could not render HDFS upload: " + e.getMessage(), e);
        }
        if (!failed.isEmpty()) {
            throw new SinkWriteException("HDFS upload failed for " + String.join(", ", failed));
        }
    }

    private void upload(String path, byte[] content, List<String> failed) {
        if (storage.writeRemote(path, content)) {
            logger.info("Uploaded to HDFS: {}", path);
        } else {
            failed.add(path);
        }
    }
}
