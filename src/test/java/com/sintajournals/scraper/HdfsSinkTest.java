package com.sintajournals.scraper;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class HdfsSinkTest {
    private static final String PARTITION = "/user/sinta/journals/2025/01/04";

    private final JournalSerializer serializer = new JournalSerializer();
    private final List<JournalRecord> records = List.of(Fixtures.record("1", "Alpha", 1, 1));

    private SinkContext context(String format) {
        RunConfig config = RunConfig.fromMap(Map.of("hdfs-enabled", "true", "output-format", format,
            "hdfs-path", "/user/sinta/journals/"));
        return new SinkContext(Fixtures.NOW, "output_journals", config);
    }

    @Test
    void testUploadsIntoDatePartition() throws SinkWriteException {
        FakeStorage storage = new FakeStorage();
        new HdfsSink(storage, serializer).write(records, context("both"));

        assertEquals(List.of(PARTITION), storage.directories);
        assertEquals(List.of(
            PARTITION + "/journals_data_" + Fixtures.TIMESTAMP + ".csv",
            PARTITION + "/journals_data_" + Fixtures.TIMESTAMP + ".json"), storage.uploads);
    }

    @Test
    void testUploadsOnlySelectedFormat() throws SinkWriteException {
        FakeStorage storage = new FakeStorage();
        new HdfsSink(storage, serializer).write(records, context("json"));
        assertEquals(List.of(PARTITION + "/journals_data_" + Fixtures.TIMESTAMP + ".json"), storage.uploads);
    }

    @Test
    void testDirectoryFailureSkipsUploads() {
        FakeStorage storage = new FakeStorage();
        storage.mkdirsSucceeds = false;

        SinkWriteException e = assertThrows(SinkWriteException.class,
            () -> new HdfsSink(storage, serializer).write(records, context("both")));
        assertTrue(e.getMessage().contains(PARTITION));
        assertTrue(storage.uploads.isEmpty());
    }

    @Test
    void testFailedUploadFailsSinkAfterTryingTheRest() {
        FakeStorage storage = new FakeStorage();
        storage.failingPaths.add(PARTITION + "/journals_data_" + Fixtures.TIMESTAMP + ".csv");

        SinkWriteException e = assertThrows(SinkWriteException.class,
            () -> new HdfsSink(storage, serializer).write(records, context("both")));
        assertTrue(e.getMessage().contains(".csv"));
        assertEquals(2, storage.uploads.size());
    }

    @Test
    void testHdfsSinkIsRemote() {
        assertTrue(new HdfsSink(new FakeStorage(), serializer).isRemote());
    }

    private static final class FakeStorage implements StorageClientInterface {
        boolean mkdirsSucceeds = true;
        final Set<String> failingPaths = new HashSet<>();
        final List<String> directories = new ArrayList<>();
        final List<String> uploads = new ArrayList<>();

        @Override
        public boolean writeLocal(Path path, byte[] content) {
            throw new AssertionError("HDFS sink must not write locally");
        }

        @Override
        public boolean ensureRemoteDir(String path) {
            directories.add(path);
            return mkdirsSucceeds;
        }

        @Override
        public boolean writeRemote(String path, byte[] content) {
            uploads.add(path);
            return content.length > 0 && !failingPaths.contains(path);
        }
    }
}
