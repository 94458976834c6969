package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs one extract-transform-load pass: captures -> records -> sinks -> statistics.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Reads every capture from the {@link CaptureSourceInterface}. An aborted source still
 *       contributes the captures it produced before failing. A source that throws counts as
 *       aborted with no captures.</li>
 *   <li>Transforms each capture with the {@link PageTransformer}, keeping records in
 *       (page sequence, extraction index) order.</li>
 *   <li>Hands the unmodifiable record set to each sink in turn. A failing sink is recorded and
 *       the next sink still runs.</li>
 *   <li>Always writes {@code extraction_stats_<timestamp>.json} to the output folder, also when
 *       the run ends early because there was no input or no record.</li>
 * </ul>
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class PipelineOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final RunConfig config;
    private final CaptureSourceInterface captureSource;
    private final PageTransformer transformer;
    private final List<SinkWriterInterface> sinks;
    private final StorageClientInterface localStorage;
    private final JournalSerializer serializer;
    private final Clock clock;

    public PipelineOrchestrator(RunConfig config,
                                CaptureSourceInterface captureSource,
                                PageTransformer transformer,
                                List<SinkWriterInterface> sinks,
                                StorageClientInterface localStorage,
                                JournalSerializer serializer,
                                Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.captureSource = Objects.requireNonNull(captureSource, "captureSource");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.sinks = List.copyOf(sinks);
        this.localStorage = Objects.requireNonNull(localStorage, "localStorage");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Builds the sinks selected by the configuration: local CSV and/or JSON according to the
     * output format, plus HDFS when enabled.
     */
    public static List<SinkWriterInterface> configuredSinks(RunConfig config, StorageClientInterface storage, JournalSerializer serializer) {
        List<SinkWriterInterface> sinks = new ArrayList<>();
        if (config.outputFormat().includesCsv()) sinks.add(new LocalCsvSink(storage, serializer));
        if (config.outputFormat().includesJson()) sinks.add(new LocalJsonSink(storage, serializer));
        if (config.hdfsEnabled()) sinks.add(new HdfsSink(storage, serializer));
        return sinks;
    }

    public RunReport run() {
        Instant started = clock.instant();
        LocalDateTime runTimestamp = LocalDateTime.now(clock);
        SinkContext context = new SinkContext(runTimestamp, captureSource.describe(), config);
        RunStatistics statistics = new RunStatistics();

        logger.info("============================================================");
        logger.info("Starting SINTA journals ETL from {}", captureSource.describe());
        logger.info("============================================================");

        CaptureBatch batch;
        try {
            batch = captureSource.readCaptures();
        } catch (RuntimeException e) {
            String error = "Capture source " + captureSource.describe() + " failed: " + e.getMessage();
            logger.error(error, e);
            batch = new CaptureBatch(List.of(), true, List.of(error));
        }
        statistics.addPages(batch.captures().size());
        batch.errors().forEach(statistics::addError);
        if (batch.aborted()) {
            logger.error("Capture source aborted after {} page(s); processing what was captured.", batch.captures().size());
        }
        if (batch.captures().isEmpty()) {
            logger.error("No pages were captured; nothing to transform.");
            statistics.addError("No input: no pages were captured");
            return finish(RunReport.Status.NO_INPUT, batch.aborted(), 0, statistics, context, started);
        }

        List<JournalRecord> records = new ArrayList<>();
        for (RawPageCapture capture : batch.captures()) {
            PageReport report = transformer.transform(capture);
            statistics.recordPage(report);
            records.addAll(report.records());
        }
        logger.info("Transform finished. Total journals extracted: {}", records.size());
        if (records.isEmpty()) {
            logger.error("No journals were extracted; skipping sinks.");
            statistics.addError("No records: no journals were extracted from " + batch.captures().size() + " page(s)");
            return finish(RunReport.Status.NO_RECORDS, batch.aborted(), 0, statistics, context, started);
        }

        List<JournalRecord> finalRecords = Collections.unmodifiableList(records);
        for (SinkWriterInterface sink : sinks) {
            try {
                sink.write(finalRecords, context);
                statistics.recordSinkSuccess(sink.isRemote());
            } catch (SinkWriteException | RuntimeException e) {
                String error = "Sink " + sink.name() + " failed: " + e.getMessage();
                logger.error(error);
                statistics.recordSinkFailure(sink.isRemote(), error);
            }
        }
        return finish(RunReport.Status.COMPLETED, batch.aborted(), finalRecords.size(), statistics, context, started);
    }

    private RunReport finish(RunReport.Status status, boolean aborted, int recordCount,
                             RunStatistics statistics, SinkContext context, Instant started) {
        statistics.finish();
        Path statisticsFile = config.outputFolder().resolve(context.statisticsFileName());
        boolean written;
        try {
            written = localStorage.writeLocal(statisticsFile, serializer.toStatisticsJson(statistics, context));
        } catch (RuntimeException e) {
            logger.error("Failed to render statistics: {}", e.getMessage());
            written = false;
        }
        if (written) {
            logger.info("Statistics saved to: {}", statisticsFile);
        } else {
            logger.error("Statistics could not be written to {}", statisticsFile);
        }

        Duration duration = Duration.between(started, clock.instant());
        logger.info("============================================================");
        logger.info("ETL finished with status {}{}", status, aborted ? " (crawl aborted)" : "");
        logger.info("Duration: {} ms", duration.toMillis());
        logger.info("Pages processed: {}", statistics.getTotalPages());
        logger.info("Journals extracted: {}", recordCount);
        logger.info("Successful extractions: {}", statistics.getSuccessfulExtractions());
        logger.info("Failed extractions: {}", statistics.getFailedExtractions());
        logger.info("Sinks ok/failed: {}/{} local, {}/{} hdfs", statistics.getSinkSuccesses(), statistics.getSinkFailures(),
            statistics.getHdfsSuccesses(), statistics.getHdfsFailures());
        logger.info("============================================================");
        return new RunReport(status, aborted, recordCount, statistics, written ? statisticsFile : null, duration);
    }
}
