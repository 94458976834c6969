package com.sintajournals.scraper;

import java.util.ArrayList;
import java.util.List;

/**
 * Central registry of the exported journal columns, in artifact order.
 * CSV headers, CSV rows and JSON object keys are all driven from this list.
 */
public final class JournalFieldRegistry {
    private JournalFieldRegistry() {}

    private static final List<JournalField> FIELDS = List.of(
        new JournalField("journal_id", JournalRecord::journalId),
        new JournalField("journal_name", JournalRecord::journalName),
        new JournalField("profile_url", JournalRecord::profileUrl),
        new JournalField("google_scholar_url", JournalRecord::googleScholarUrl),
        new JournalField("website_url", JournalRecord::websiteUrl),
        new JournalField("editor_url", JournalRecord::editorUrl),
        new JournalField("affiliation", JournalRecord::affiliation),
        new JournalField("affiliation_url", JournalRecord::affiliationUrl),
        new JournalField("p_issn", JournalRecord::pIssn),
        new JournalField("e_issn", JournalRecord::eIssn),
        new JournalField("subject_area", JournalRecord::subjectArea),
        new JournalField("accreditation", JournalRecord::accreditation),
        new JournalField("is_scopus_indexed", JournalRecord::scopusIndexed),
        new JournalField("is_garuda_indexed", JournalRecord::garudaIndexed),
        new JournalField("garuda_url", JournalRecord::garudaUrl),
        new JournalField("impact_score", JournalRecord::impactScore),
        new JournalField("h5_index", JournalRecord::h5Index),
        new JournalField("citations_5yr", JournalRecord::citations5yr),
        new JournalField("citations_total", JournalRecord::citationsTotal),
        new JournalField("cover_image_url", JournalRecord::coverImageUrl),
        new JournalField("source_page_sequence", JournalRecord::sourcePageSequence),
        new JournalField("extraction_index", JournalRecord::extractionIndex),
        new JournalField("extracted_at", r -> r.extractedAt().toString())
    );

    /**
     * Returns the list of all exported fields.
     */
    public static List<JournalField> getFields() {
        return FIELDS;
    }

    /**
     * Returns the list of all field names, in column order.
     */
    public static List<String> getFieldNames() {
        List<String> names = new ArrayList<>();
        for (JournalField f : FIELDS) names.add(f.fieldName);
        return names;
    }

    /**
     * Returns the JournalField for a given field name, or null if not found.
     */
    public static JournalField getField(String name) {
        for (JournalField f : FIELDS) if (f.fieldName.equals(name)) return f;
        return null;
    }
}
