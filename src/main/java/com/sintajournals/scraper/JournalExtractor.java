package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps one SINTA listing entry ({@code div.list-item.row.mt-3}) to a {@link JournalRecord}.
 * <p>
 * Extraction workflow:
 * <ul>
 *   <li>Each field group (name, links, affiliation, identifiers, status, statistics, cover) is
 *       read by an independent lookup that returns an {@link Optional}.</li>
 *   <li>A lookup that finds nothing, or that fails, leaves its fields at the empty default and
 *       is logged at debug level. It never aborts the record.</li>
 *   <li>Only a missing fragment or a failure while assembling the record produces an
 *       {@link ExtractionResult#failure(String)}; nothing is thrown to the caller.</li>
 * </ul>
 * <p>
 * The statistics block pairs {@code pr-txt} labels and {@code pr-num} values by position and
 * stops at the shorter of the two lists.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class JournalExtractor {
    private static final Logger logger = LoggerFactory.getLogger(JournalExtractor.class);

    static final Marker NAME_CONTAINER = Marker.of("div", "affil-name");
    static final Marker LINK_CONTAINER = Marker.of("div", "affil-abbrev");
    static final Marker LOCATION_CONTAINER = Marker.of("div", "affil-loc");
    static final Marker IDENTIFIERS = Marker.of("div", "profile-id");
    static final Marker STATUS_BLOCK = Marker.of("div", "stat-prev");
    static final Marker ACCREDITED = Marker.of("span", "num-stat", "accredited");
    static final Marker SCOPUS_INDEXED = Marker.of("span", "num-stat", "scopus-indexed");
    static final Marker GARUDA_LINK = Marker.withAttributeContaining("a", "href", "garuda");
    static final Marker STATS_BLOCK = Marker.of("div", "stat-profile", "journal-list-stat");
    static final Marker STATS_ROW = Marker.of("div", "row", "no-gutters");
    static final Marker STAT_LABEL = Marker.of("div", "pr-txt");
    static final Marker STAT_VALUE = Marker.of("div", "pr-num");
    static final Marker COVER_IMAGE = Marker.of("img", "journal-cover");
    static final Marker ANCHOR = Marker.of("a");
    static final Marker WEBSITE_ICON = Marker.anyTag("el-globe");
    static final Marker EDITOR_ICON = Marker.anyTag("el-globe-alt");

    private static final Pattern PROFILE_ID = Pattern.compile("/profile/(\\d+)");
    private static final Pattern P_ISSN = Pattern.compile("P-ISSN\\s*:\\s*(\\d+)");
    private static final Pattern E_ISSN = Pattern.compile("E-ISSN\\s*:\\s*(\\d+)");
    private static final Pattern SUBJECT_AREA = Pattern.compile("Subject Area\\s*:\\s*([^|]+)");
    private static final Pattern ACCREDITATION = Pattern.compile("(S\\d+)");

    private final Clock clock;

    public JournalExtractor() {
        this(Clock.systemDefaultZone());
    }

    public JournalExtractor(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Extracts one journal entry.
     * @param fragment candidate entry fragment (may be null)
     * @param pageSequence sequence number of the capture the fragment belongs to
     * @param index 1-based position of the fragment within its capture
     * @return a success carrying a fully populated record, or a failure with its reason
     */
    public ExtractionResult extract(MarkupFragment fragment, int pageSequence, int index) {
        if (fragment == null) {
            logger.warn("extract called with null fragment (page {}, index {}).", pageSequence, index);
            return ExtractionResult.failure("fragment is missing");
        }
        try {
            JournalRecord.Builder builder = JournalRecord.builder()
                .sourcePageSequence(pageSequence)
                .extractionIndex(index)
                .extractedAt(LocalDateTime.now(clock));
            extractNameAndProfile(fragment, builder);
            extractLinks(fragment, builder);
            extractAffiliation(fragment, builder);
            extractIdentifiers(fragment, builder);
            extractStatus(fragment, builder);
            extractStatistics(fragment, builder);
            lookup("cover image", () -> first(fragment, COVER_IMAGE).flatMap(img -> img.attribute("src")))
                .ifPresent(builder::coverImageUrl);
            return ExtractionResult.success(builder.build());
        } catch (RuntimeException e) {
            logger.warn("Failed to assemble journal record (page {}, index {}): {}", pageSequence, index, e.getMessage());
            return ExtractionResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void extractNameAndProfile(MarkupFragment fragment, JournalRecord.Builder builder) {
        Optional<MarkupFragment> nameLink = lookupFragment("name link",
            () -> first(fragment, NAME_CONTAINER).flatMap(c -> first(c, ANCHOR)));
        if (nameLink.isEmpty()) return;
        MarkupFragment link = nameLink.get();
        builder.journalName(safeText(link));
        String profileUrl = safeAttr(link, "href");
        builder.profileUrl(profileUrl);
        builder.journalId(firstGroup(PROFILE_ID, profileUrl).orElse(""));
    }

    private void extractLinks(MarkupFragment fragment, JournalRecord.Builder builder) {
        List<MarkupFragment> links = lookupAll("secondary links",
            () -> first(fragment, LINK_CONTAINER).map(c -> c.findAll(ANCHOR)).orElse(List.of()));
        String scholar = "";
        String website = "";
        String editor = "";
        for (MarkupFragment link : links) {
            String href = safeAttr(link, "href");
            String text = safeText(link);
            if (href.contains("scholar.google")) {
                if (scholar.isEmpty()) scholar = href;
            } else if (text.contains("Editor URL") || hasDescendant(link, EDITOR_ICON)) {
                if (editor.isEmpty()) editor = href;
            } else if (text.contains("Website") || hasDescendant(link, WEBSITE_ICON)) {
                if (website.isEmpty()) website = href;
            } else {
                logger.debug("Ignoring unclassified link '{}' ({})", text, href);
            }
        }
        builder.googleScholarUrl(scholar).websiteUrl(website).editorUrl(editor);
    }

    private void extractAffiliation(MarkupFragment fragment, JournalRecord.Builder builder) {
        lookupFragment("affiliation link", () -> first(fragment, LOCATION_CONTAINER).flatMap(c -> first(c, ANCHOR)))
            .ifPresent(link -> builder.affiliation(safeText(link)).affiliationUrl(safeAttr(link, "href")));
    }

    private void extractIdentifiers(MarkupFragment fragment, JournalRecord.Builder builder) {
        Optional<String> text = lookup("identifiers block", () -> first(fragment, IDENTIFIERS).map(MarkupFragment::text));
        if (text.isEmpty()) return;
        String block = text.get();
        firstGroup(P_ISSN, block).ifPresent(builder::pIssn);
        firstGroup(E_ISSN, block).ifPresent(builder::eIssn);
        firstGroup(SUBJECT_AREA, block).map(String::trim).ifPresent(builder::subjectArea);
    }

    private void extractStatus(MarkupFragment fragment, JournalRecord.Builder builder) {
        Optional<MarkupFragment> status = lookupFragment("status block", () -> first(fragment, STATUS_BLOCK));
        if (status.isEmpty()) return;
        MarkupFragment block = status.get();
        lookup("accreditation", () -> first(block, ACCREDITED).flatMap(span -> firstGroup(ACCREDITATION, safeText(span))))
            .ifPresent(builder::accreditation);
        builder.scopusIndexed(hasDescendant(block, SCOPUS_INDEXED));
        lookupFragment("garuda link", () -> first(block, GARUDA_LINK)).ifPresent(link -> {
            builder.garudaIndexed(true);
            builder.garudaUrl(safeAttr(link, "href"));
        });
    }

    private void extractStatistics(MarkupFragment fragment, JournalRecord.Builder builder) {
        Optional<MarkupFragment> stats = lookupFragment("statistics block", () -> first(fragment, STATS_BLOCK));
        if (stats.isEmpty() || !hasDescendant(stats.get(), STATS_ROW)) return;
        List<MarkupFragment> labels = lookupAll("statistic labels", () -> stats.get().findAll(STAT_LABEL));
        List<MarkupFragment> values = lookupAll("statistic values", () -> stats.get().findAll(STAT_VALUE));
        if (labels.size() != values.size()) {
            logger.debug("Statistic labels ({}) and values ({}) differ in count; pairing the first {}",
                labels.size(), values.size(), Math.min(labels.size(), values.size()));
        }
        int pairs = Math.min(labels.size(), values.size());
        for (int i = 0; i < pairs; i++) {
            String label = safeText(labels.get(i));
            String value = safeText(values.get(i));
            if (label.contains("Impact")) {
                builder.impactScore(value);
            } else if (label.contains("H5-index")) {
                builder.h5Index(value);
            } else if (label.contains("Citations 5yr")) {
                builder.citations5yr(value);
            } else if (label.contains("Citations") && !label.contains("5yr")) {
                builder.citationsTotal(value);
            }
        }
    }

    // --- Fallible lookups: every failure degrades to an empty result ---

    private static Optional<String> lookup(String description, Supplier<Optional<String>> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            logger.debug("Lookup of {} failed: {}", description, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<MarkupFragment> lookupFragment(String description, Supplier<Optional<MarkupFragment>> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            logger.debug("Lookup of {} failed: {}", description, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<MarkupFragment> lookupAll(String description, Supplier<List<MarkupFragment>> supplier) {
        try {
            List<MarkupFragment> result = supplier.get();
            return result == null ? List.of() : result;
        } catch (RuntimeException e) {
            logger.debug("Lookup of {} failed: {}", description, e.getMessage());
            return List.of();
        }
    }

    private static Optional<MarkupFragment> first(MarkupFragment parent, Marker marker) {
        Optional<MarkupFragment> found = parent.findFirst(marker);
        return found == null ? Optional.empty() : found;
    }

    private static boolean hasDescendant(MarkupFragment parent, Marker marker) {
        return lookupFragment(marker.toCssQuery(), () -> first(parent, marker)).isPresent();
    }

    private static String safeText(MarkupFragment f) {
        try {
            String s = f.text();
            return s == null ? "" : s.trim();
        } catch (RuntimeException e) {
            logger.debug("Failed to get text: {}", e.getMessage());
            return "";
        }
    }

    private static String safeAttr(MarkupFragment f, String attr) {
        try {
            Optional<String> value = f.attribute(attr);
            return value == null ? "" : value.map(String::trim).orElse("");
        } catch (RuntimeException e) {
            logger.debug("Failed to get attribute '{}': {}", attr, e.getMessage());
            return "";
        }
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
