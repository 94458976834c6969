package com.sintajournals.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PageTransformerTest {
    private final JournalExtractor extractor = new JournalExtractor(Fixtures.CLOCK);

    @Test
    void testTransformKeepsDocumentOrder() {
        PageReport report = new PageTransformer(extractor).transform(Fixtures.capture(3, Fixtures.journalsPage()));

        assertFalse(report.parseFailed());
        assertEquals(3, report.sequenceNumber());
        assertEquals(3, report.candidateCount());
        assertEquals(3, report.successCount());
        assertEquals(0, report.failedCount());
        assertTrue(report.pageErrors().isEmpty());
        assertEquals(List.of("4321", "5555", ""),
            report.records().stream().map(JournalRecord::journalId).collect(Collectors.toList()));
        assertEquals(List.of(1, 2, 3),
            report.records().stream().map(JournalRecord::extractionIndex).collect(Collectors.toList()));
        assertTrue(report.records().stream().allMatch(r -> r.sourcePageSequence() == 3));
    }

    @Test
    void testZeroCandidatesIsNotAnError() {
        PageReport report = new PageTransformer(extractor).transform(
            Fixtures.capture(1, "<html><body><table class='table'></table></body></html>"));

        assertFalse(report.parseFailed());
        assertEquals(0, report.candidateCount());
        assertTrue(report.records().isEmpty());
        assertTrue(report.pageErrors().isEmpty());
    }

    @Test
    void testFailingEntryDoesNotStopTheOthers() {
        JournalExtractor failingSecond = new JournalExtractor(Fixtures.CLOCK) {
            @Override
            public ExtractionResult extract(MarkupFragment fragment, int pageSequence, int index) {
                if (index == 2) return ExtractionResult.failure("broken entry");
                return super.extract(fragment, pageSequence, index);
            }
        };
        PageReport report = new PageTransformer(failingSecond).transform(Fixtures.capture(1, Fixtures.journalsPage()));

        assertEquals(3, report.candidateCount());
        assertEquals(2, report.successCount());
        assertEquals(1, report.failedCount());
        assertEquals(List.of(1, 3),
            report.records().stream().map(JournalRecord::extractionIndex).collect(Collectors.toList()));
        assertEquals(1, report.pageErrors().size());
        String error = report.pageErrors().get(0);
        assertTrue(error.startsWith("Error extracting journal #2 from page 1"), error);
        assertTrue(error.contains("broken entry"), error);
    }

    @Test
    void testThrowingExtractorIsContained() {
        JournalExtractor throwing = new JournalExtractor(Fixtures.CLOCK) {
            @Override
            public ExtractionResult extract(MarkupFragment fragment, int pageSequence, int index) {
                throw new IllegalStateException("boom " + index);
            }
        };
        PageReport report = new PageTransformer(throwing).transform(Fixtures.capture(1, Fixtures.journalsPage()));

        assertEquals(0, report.successCount());
        assertEquals(3, report.failedCount());
        assertTrue(report.pageErrors().get(2).contains("boom 3"));
    }

    @Test
    void testParseFailure() {
        PageTransformer transformer = new PageTransformer(extractor, html -> {
            throw new IllegalArgumentException("unreadable markup");
        });
        PageReport report = transformer.transform(Fixtures.capture(7, "<html>"));

        assertTrue(report.parseFailed());
        assertEquals(7, report.sequenceNumber());
        assertTrue(report.records().isEmpty());
        assertEquals(1, report.pageErrors().size());
        assertTrue(report.pageErrors().get(0).contains("unreadable markup"));
    }

    @Test
    void testEntryMarkerRequiresAllClasses() {
        assertEquals("div.list-item.mt-3.row", PageTransformer.JOURNAL_ENTRY.toCssQuery());
    }
}
