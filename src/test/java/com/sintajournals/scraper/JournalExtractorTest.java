package com.sintajournals.scraper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JournalExtractorTest {
    private JournalExtractor extractor;
    private List<MarkupFragment> entries;

    @BeforeEach
    void setUp() {
        extractor = new JournalExtractor(Fixtures.CLOCK);
        entries = JsoupMarkupFragment.parse(Fixtures.journalsPage()).findAll(PageTransformer.JOURNAL_ENTRY);
    }

    @Test
    void testFixtureHasThreeCandidates() {
        assertEquals(3, entries.size());
    }

    @Test
    void testExtractFullEntry() {
        ExtractionResult result = extractor.extract(entries.get(0), 4, 1);
        assertTrue(result.isSuccess());
        JournalRecord r = result.record();
        assertEquals("4321", r.journalId());
        assertEquals("Jurnal X", r.journalName());
        assertEquals("https://sinta.kemdiktisaintek.go.id/journals/profile/4321", r.profileUrl());
        assertEquals("12345678", r.pIssn());
        assertEquals("87654321", r.eIssn());
        assertEquals("Computer Science", r.subjectArea());
        assertEquals("S2", r.accreditation());
        assertEquals("Universitas Contoh", r.affiliation());
        assertEquals("https://sinta.kemdiktisaintek.go.id/affiliations/profile/77", r.affiliationUrl());
        assertEquals("https://sinta.kemdiktisaintek.go.id/cover/4321.jpg", r.coverImageUrl());
        assertTrue(r.scopusIndexed());
        assertTrue(r.garudaIndexed());
        assertEquals("https://garuda.kemdikbud.go.id/journal/view/999", r.garudaUrl());
        assertEquals(4, r.sourcePageSequence());
        assertEquals(1, r.extractionIndex());
        assertEquals(Fixtures.NOW, r.extractedAt());
    }

    @Test
    void testLinksClassifiedByHrefAndLabel() {
        JournalRecord r = extractor.extract(entries.get(0), 1, 1).record();
        assertEquals("https://scholar.google.com/citations?user=abc123", r.googleScholarUrl());
        assertEquals("https://jurnalx.ac.id", r.websiteUrl());
        assertEquals("https://jurnalx.ac.id/editor", r.editorUrl());
    }

    @Test
    void testIconOnlyLinksDoNotMixUpWebsiteAndEditor() {
        JournalRecord r = extractor.extract(entries.get(1), 1, 2).record();
        assertEquals("https://icons.ac.id/editorial", r.editorUrl());
        // first website-classified link wins
        assertEquals("https://icons.ac.id", r.websiteUrl());
        assertEquals("", r.googleScholarUrl());
    }

    @Test
    void testStatisticsPairedByPosition() {
        JournalRecord full = extractor.extract(entries.get(0), 1, 1).record();
        assertEquals("3.25", full.impactScore());
        assertEquals("18", full.h5Index());
        assertEquals("1,204", full.citations5yr());
        assertEquals("2,310", full.citationsTotal());

        // three values but two labels: the unpaired value is dropped
        JournalRecord truncated = extractor.extract(entries.get(1), 1, 2).record();
        assertEquals("0.5", truncated.impactScore());
        assertEquals("4", truncated.h5Index());
        assertEquals("", truncated.citations5yr());
        assertEquals("", truncated.citationsTotal());
    }

    @Test
    void testPartialEntryKeepsDefaults() {
        JournalRecord r = extractor.extract(entries.get(1), 1, 2).record();
        assertEquals("5555", r.journalId());
        assertEquals("", r.pIssn());
        assertEquals("24680135", r.eIssn());
        assertEquals("", r.subjectArea());
        assertEquals("S4", r.accreditation());
        assertFalse(r.scopusIndexed());
        assertFalse(r.garudaIndexed());
        assertEquals("", r.garudaUrl());
        assertEquals("", r.affiliation());
    }

    @Test
    void testEntryWithoutBlocksIsStillARecord() {
        ExtractionResult result = extractor.extract(entries.get(2), 1, 3);
        assertTrue(result.isSuccess());
        JournalRecord r = result.record();
        assertEquals("", r.journalId());
        assertEquals("", r.journalName());
        assertEquals("", r.impactScore());
        assertFalse(r.scopusIndexed());
        assertEquals(3, r.extractionIndex());
    }

    @Test
    void testNameMatchingAnchorOnly() {
        String html = "<div class='list-item row mt-3'><div class='affil-name'>"
            + "<a href='https://sinta.kemdiktisaintek.go.id/journals/profile/abc'>No Numeric Id</a></div></div>";
        MarkupFragment entry = JsoupMarkupFragment.parse(html).findFirst(PageTransformer.JOURNAL_ENTRY).orElseThrow();
        JournalRecord r = extractor.extract(entry, 1, 1).record();
        assertEquals("No Numeric Id", r.journalName());
        assertEquals("", r.journalId());
    }

    @Test
    void testNullFragmentIsFailure() {
        ExtractionResult result = extractor.extract(null, 1, 1);
        assertFalse(result.isSuccess());
        assertTrue(result.asOptional().isEmpty());
        assertNotNull(result.failureReason());
    }

    @Test
    void testThrowingFragmentNeverEscapes() {
        ExtractionResult result = assertDoesNotThrow(() -> extractor.extract(new ThrowingFragment(), 2, 5));
        assertTrue(result.isSuccess());
        assertEquals("", result.record().journalName());
        assertEquals(5, result.record().extractionIndex());
    }

    @Test
    void testInvalidIndexIsFailure() {
        ExtractionResult result = extractor.extract(entries.get(0), 1, 0);
        assertFalse(result.isSuccess());
        assertTrue(result.failureReason().contains("extractionIndex"));
    }

    /**
     * Fragment whose every lookup fails.
     */
    private static final class ThrowingFragment implements MarkupFragment {
        @Override
        public Optional<MarkupFragment> findFirst(Marker marker) {
            throw new IllegalStateException("detached node");
        }

        @Override
        public List<MarkupFragment> findAll(Marker marker) {
            throw new IllegalStateException("detached node");
        }

        @Override
        public Optional<String> attribute(String name) {
            throw new IllegalStateException("detached node");
        }

        @Override
        public String text() {
            throw new IllegalStateException("detached node");
        }
    }
}
