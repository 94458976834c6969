package com.sintajournals.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencsv.CSVWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders records and run statistics into the CSV and JSON artifact formats.
 * <p>
 * Column order and JSON key order both follow {@link JournalFieldRegistry}. CSV cells are
 * quoted only when needed; empty fields are empty cells and booleans are {@code true}/{@code false}.
 */
public class JournalSerializer {
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public byte[] toCsv(List<JournalRecord> records) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CSVWriter writer = new CSVWriter(
                new OutputStreamWriter(out, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {
            writer.writeNext(JournalFieldRegistry.getFieldNames().toArray(String[]::new), false);
            for (JournalRecord record : records) {
                writer.writeNext(JournalFieldRegistry.getFields().stream()
                    .map(f -> f.textOf(record))
                    .toArray(String[]::new), false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("CSV rendering failed", e);
        }
        return out.toByteArray();
    }

    public byte[] toJson(List<JournalRecord> records, SinkContext context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("total_journals", records.size());
        metadata.put("extraction_date", context.runTimestamp().toString());
        metadata.put("source_folder", context.source());

        List<Map<String, Object>> journals = new ArrayList<>(records.size());
        for (JournalRecord record : records) {
            journals.add(toMap(record));
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("metadata", metadata);
        output.put("journals", journals);
        return write(output);
    }

    public byte[] toStatisticsJson(RunStatistics statistics, SinkContext context) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("extraction_date", context.runTimestamp().toString());
        output.put("statistics", statistics.toMap());
        return write(output);
    }

    static Map<String, Object> toMap(JournalRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (JournalField field : JournalFieldRegistry.getFields()) {
            row.put(field.fieldName, field.valueOf(record));
        }
        return row;
    }

    private byte[] write(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("JSON rendering failed", e);
        }
    }
}
