package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Applies the {@link JournalExtractor} to every journal entry of a captured page.
 * <p>
 * Entries are located by the {@code div.list-item.row.mt-3} marker and processed in document
 * order. A failing entry becomes a page error carrying its 1-based index; the remaining
 * entries are still processed. A page without entries yields an empty report, which is not
 * an error. A page whose markup cannot be parsed yields a parse-failure report.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class PageTransformer {
    private static final Logger logger = LoggerFactory.getLogger(PageTransformer.class);

    static final Marker JOURNAL_ENTRY = Marker.of("div", "list-item", "row", "mt-3");

    private final JournalExtractor extractor;
    private final Function<String, MarkupFragment> parser;

    public PageTransformer(JournalExtractor extractor) {
        this(extractor, JsoupMarkupFragment::parse);
    }

    public PageTransformer(JournalExtractor extractor, Function<String, MarkupFragment> parser) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public PageReport transform(RawPageCapture capture) {
        int sequence = capture.sequenceNumber();
        String source = describe(capture);
        List<MarkupFragment> candidates;
        try {
            MarkupFragment page = parser.apply(capture.markup());
            candidates = page.findAll(JOURNAL_ENTRY);
        } catch (RuntimeException e) {
            String error = String.format("Error parsing HTML %s: %s", source, e.getMessage());
            logger.error(error);
            return PageReport.parseFailure(sequence, error);
        }

        logger.info("Found {} journals in {}", candidates.size(), source);
        List<JournalRecord> records = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            int index = i + 1;
            String failure;
            try {
                ExtractionResult result = extractor.extract(candidates.get(i), sequence, index);
                if (result.isSuccess()) {
                    records.add(result.record());
                    continue;
                }
                failure = result.failureReason();
            } catch (RuntimeException e) {
                failure = e.getMessage();
            }
            String error = String.format("Error extracting journal #%d from %s: %s", index, source, failure);
            logger.error(error);
            errors.add(error);
        }
        return new PageReport(sequence, records, errors, candidates.size(), errors.size(), false);
    }

    private static String describe(RawPageCapture capture) {
        return capture.origin().isEmpty()
            ? "page " + capture.sequenceNumber()
            : "page " + capture.sequenceNumber() + " (" + capture.origin() + ")";
    }
}
