package com.sintajournals.scraper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Shared test data.
 */
final class Fixtures {
    static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-04T08:30:12Z"), ZoneOffset.UTC);
    static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    static final String TIMESTAMP = "20250104_083012";

    private Fixtures() {}

    static String journalsPage() {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/journals_page.html")) {
            if (in == null) throw new IllegalStateException("fixture journals_page.html missing");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static RawPageCapture capture(int sequence, String markup) {
        return new RawPageCapture(sequence, markup, NOW, "page" + sequence + ".html");
    }

    static JournalRecord record(String id, String name, int page, int index) {
        return JournalRecord.builder()
            .journalId(id)
            .journalName(name)
            .profileUrl("https://sinta.kemdiktisaintek.go.id/journals/profile/" + id)
            .pIssn("12345678")
            .accreditation("S2")
            .scopusIndexed(true)
            .sourcePageSequence(page)
            .extractionIndex(index)
            .extractedAt(NOW)
            .build();
    }
}
