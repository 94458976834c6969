package com.sintajournals.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LocalSinkTest {
    @TempDir
    Path tempDir;

    private final JournalSerializer serializer = new JournalSerializer();
    private final List<JournalRecord> records = List.of(
        Fixtures.record("1", "Alpha", 1, 1),
        Fixtures.record("2", "Beta", 1, 2));

    private SinkContext context(Path outputFolder) {
        RunConfig config = RunConfig.fromMap(Map.of("output-folder", outputFolder.toString()));
        return new SinkContext(Fixtures.NOW, "output_journals", config);
    }

    @Test
    void testCsvSinkWritesFileInOutputFolder() throws Exception {
        Path out = tempDir.resolve("nested").resolve("out");
        new LocalCsvSink(new StorageClient(), serializer).write(records, context(out));

        Path file = out.resolve("journals_data_" + Fixtures.TIMESTAMP + ".csv");
        try (CSVReader reader = new CSVReader(new FileReader(file.toFile(), StandardCharsets.UTF_8))) {
            List<String[]> lines = reader.readAll();
            assertEquals(3, lines.size());
            assertEquals("journal_id", lines.get(0)[0]);
            assertEquals("Alpha", lines.get(1)[1]);
            assertEquals("Beta", lines.get(2)[1]);
        }
    }

    @Test
    void testJsonSinkWritesFileInOutputFolder() throws Exception {
        new LocalJsonSink(new StorageClient(), serializer).write(records, context(tempDir));

        JsonNode root = new ObjectMapper().readTree(tempDir.resolve("journals_data_" + Fixtures.TIMESTAMP + ".json").toFile());
        assertEquals(2, root.path("metadata").path("total_journals").asInt());
        assertEquals("2", root.path("journals").get(1).path("journal_id").asText());
    }

    @Test
    void testUnwritableFolderFailsTheSink() throws IOException {
        // a regular file where the output folder should be
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        SinkContext context = context(blocker);

        assertThrows(SinkWriteException.class, () -> new LocalCsvSink(new StorageClient(), serializer).write(records, context));
        assertThrows(SinkWriteException.class, () -> new LocalJsonSink(new StorageClient(), serializer).write(records, context));
    }

    @Test
    void testLocalSinksAreNotRemote() {
        assertFalse(new LocalCsvSink(new StorageClient(), serializer).isRemote());
        assertFalse(new LocalJsonSink(new StorageClient(), serializer).isRemote());
        assertEquals("local-csv", new LocalCsvSink(new StorageClient(), serializer).name());
        assertEquals("local-json", new LocalJsonSink(new StorageClient(), serializer).name());
    }

    @Test
    void testCsvSinkRejectsNullRecords() {
        assertThrows(IllegalArgumentException.class,
            () -> new LocalCsvSink(new StorageClient(), serializer).write(null, context(tempDir)));
    }
}
