package com.sintajournals.scraper;

import java.time.LocalDateTime;

/**
 * Immutable, normalized record for one journal entry of the SINTA catalog.
 * <p>
 * The schema is closed and total: string fields are never null (absent values become
 * {@code ""}), boolean flags default to {@code false}. Column order for every artifact is
 * defined by {@link JournalFieldRegistry}.
 * <p>
 * {@code sourcePageSequence} and {@code extractionIndex} identify the capture and the 1-based
 * position within that capture the record was extracted from.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public record JournalRecord(
    String journalId,
    String journalName,
    String profileUrl,
    String googleScholarUrl,
    String websiteUrl,
    String editorUrl,
    String affiliation,
    String affiliationUrl,
    String pIssn,
    String eIssn,
    String subjectArea,
    String accreditation,
    boolean scopusIndexed,
    boolean garudaIndexed,
    String garudaUrl,
    String impactScore,
    String h5Index,
    String citations5yr,
    String citationsTotal,
    String coverImageUrl,
    int sourcePageSequence,
    int extractionIndex,
    LocalDateTime extractedAt
) {
    public JournalRecord {
        journalId = orEmpty(journalId);
        journalName = orEmpty(journalName);
        profileUrl = orEmpty(profileUrl);
        googleScholarUrl = orEmpty(googleScholarUrl);
        websiteUrl = orEmpty(websiteUrl);
        editorUrl = orEmpty(editorUrl);
        affiliation = orEmpty(affiliation);
        affiliationUrl = orEmpty(affiliationUrl);
        pIssn = orEmpty(pIssn);
        eIssn = orEmpty(eIssn);
        subjectArea = orEmpty(subjectArea);
        accreditation = orEmpty(accreditation);
        garudaUrl = orEmpty(garudaUrl);
        impactScore = orEmpty(impactScore);
        h5Index = orEmpty(h5Index);
        citations5yr = orEmpty(citations5yr);
        citationsTotal = orEmpty(citationsTotal);
        coverImageUrl = orEmpty(coverImageUrl);
        if (extractionIndex < 1) {
            throw new IllegalArgumentException("extractionIndex must be positive: " + extractionIndex);
        }
        if (extractedAt == null) {
            throw new IllegalArgumentException("extractedAt is required");
        }
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable builder; every field not set keeps its empty default.
     */
    public static final class Builder {
        private String journalId;
        private String journalName;
        private String profileUrl;
        private String googleScholarUrl;
        private String websiteUrl;
        private String editorUrl;
        private String affiliation;
        private String affiliationUrl;
        private String pIssn;
        private String eIssn;
        private String subjectArea;
        private String accreditation;
        private boolean scopusIndexed;
        private boolean garudaIndexed;
        private String garudaUrl;
        private String impactScore;
        private String h5Index;
        private String citations5yr;
        private String citationsTotal;
        private String coverImageUrl;
        private int sourcePageSequence;
        private int extractionIndex;
        private LocalDateTime extractedAt;

        private Builder() {}

        public Builder journalId(String v) { this.journalId = v; return this; }
        public Builder journalName(String v) { this.journalName = v; return this; }
        public Builder profileUrl(String v) { this.profileUrl = v; return this; }
        public Builder googleScholarUrl(String v) { this.googleScholarUrl = v; return this; }
        public Builder websiteUrl(String v) { this.websiteUrl = v; return this; }
        public Builder editorUrl(String v) { this.editorUrl = v; return this; }
        public Builder affiliation(String v) { this.affiliation = v; return this; }
        public Builder affiliationUrl(String v) { this.affiliationUrl = v; return this; }
        public Builder pIssn(String v) { this.pIssn = v; return this; }
        public Builder eIssn(String v) { this.eIssn = v; return this; }
        public Builder subjectArea(String v) { this.subjectArea = v; return this; }
        public Builder accreditation(String v) { this.accreditation = v; return this; }
        public Builder scopusIndexed(boolean v) { this.scopusIndexed = v; return this; }
        public Builder garudaIndexed(boolean v) { this.garudaIndexed = v; return this; }
        public Builder garudaUrl(String v) { this.garudaUrl = v; return this; }
        public Builder impactScore(String v) { this.impactScore = v; return this; }
        public Builder h5Index(String v) { this.h5Index = v; return this; }
        public Builder citations5yr(String v) { this.citations5yr = v; return this; }
        public Builder citationsTotal(String v) { this.citationsTotal = v; return this; }
        public Builder coverImageUrl(String v) { this.coverImageUrl = v; return this; }
        public Builder sourcePageSequence(int v) { this.sourcePageSequence = v; return this; }
        public Builder extractionIndex(int v) { this.extractionIndex = v; return this; }
        public Builder extractedAt(LocalDateTime v) { this.extractedAt = v; return this; }

        public JournalRecord build() {
            return new JournalRecord(
                journalId,
                journalName,
                profileUrl,
                googleScholarUrl,
                websiteUrl,
                editorUrl,
                affiliation,
                affiliationUrl,
                pIssn,
                eIssn,
                subjectArea,
                accreditation,
                scopusIndexed,
                garudaIndexed,
                garudaUrl,
                impactScore,
                h5Index,
                citations5yr,
                citationsTotal,
                coverImageUrl,
                sourcePageSequence,
                extractionIndex,
                extractedAt
            );
        }
    }
}
