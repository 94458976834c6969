package com.sintajournals.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class JournalRecordTest {
    @Test
    void testUnsetFieldsAreEmpty() {
        JournalRecord record = JournalRecord.builder().extractionIndex(1).extractedAt(Fixtures.NOW).build();
        for (JournalField field : JournalFieldRegistry.getFields()) {
            assertNotNull(field.valueOf(record), field.fieldName);
        }
        assertEquals("", record.journalName());
        assertFalse(record.garudaIndexed());
    }

    @Test
    void testIndexAndTimeAreRequired() {
        assertThrows(IllegalArgumentException.class,
            () -> JournalRecord.builder().extractionIndex(0).extractedAt(Fixtures.NOW).build());
        assertThrows(IllegalArgumentException.class,
            () -> JournalRecord.builder().extractionIndex(1).build());
    }

    @Test
    void testRegistryLookup() {
        JournalField field = JournalFieldRegistry.getField("accreditation");
        assertNotNull(field);
        assertEquals("S2", field.textOf(Fixtures.record("1", "Alpha", 1, 1)));
        assertNull(JournalFieldRegistry.getField("title"));
        assertEquals("true", JournalFieldRegistry.getField("is_scopus_indexed").textOf(Fixtures.record("1", "Alpha", 1, 1)));
    }

    @Test
    void testColumnOrder() {
        assertEquals(List.of(
            "journal_id", "journal_name", "profile_url", "google_scholar_url", "website_url", "editor_url",
            "affiliation", "affiliation_url", "p_issn", "e_issn", "subject_area", "accreditation",
            "is_scopus_indexed", "is_garuda_indexed", "garuda_url", "impact_score", "h5_index",
            "citations_5yr", "citations_total", "cover_image_url", "source_page_sequence",
            "extraction_index", "extracted_at"), JournalFieldRegistry.getFieldNames());
    }

    @Test
    void testMarkerMatchesByClassContainment() {
        MarkupFragment page = JsoupMarkupFragment.parse(
            "<div class='stat-prev extra'><span class='num-stat accredited big'>S3</span>"
                + "<a href='https://garuda.kemdikbud.go.id/x'>G</a><a href='https://other.org'>O</a></div>");

        Optional<MarkupFragment> accredited = page.findFirst(Marker.of("span", "accredited", "num-stat"));
        assertTrue(accredited.isPresent());
        assertEquals("S3", accredited.get().text());
        assertTrue(page.findFirst(Marker.of("div", "stat-prev")).isPresent());
        assertTrue(page.findFirst(Marker.of("span", "scopus-indexed")).isEmpty());

        List<MarkupFragment> garuda = page.findAll(Marker.withAttributeContaining("a", "href", "garuda"));
        assertEquals(1, garuda.size());
        assertEquals(Optional.of("https://garuda.kemdikbud.go.id/x"), garuda.get(0).attribute("href"));
        assertEquals(Optional.empty(), garuda.get(0).attribute("title"));
    }

    @Test
    void testMarkerQuery() {
        assertEquals("*", Marker.anyTag().toCssQuery());
        assertEquals(".el-globe", Marker.anyTag("el-globe").toCssQuery());
        assertEquals("a[href*=garuda]", Marker.withAttributeContaining("a", "href", "garuda").toCssQuery());
        assertThrows(IllegalArgumentException.class, () -> new Marker("a", null, "href", null));
    }
}
