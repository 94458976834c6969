package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * Main entry point for the SINTA journals scraper.
 * <p>
 * Modes (first argument or {@code --mode=}):
 * <ul>
 *   <li>{@code crawl}: crawl the filtered listing with Playwright, archive each page to the
 *       input folder, then extract and write the records.</li>
 *   <li>{@code scrape}: crawl and archive only.</li>
 *   <li>{@code etl}: extract and write records from pages archived earlier.</li>
 * </ul>
 * See {@link RunConfig} for the other options. The process exits with 1 when the crawl was
 * aborted, the browser could not be started or the configuration is invalid, 0 otherwise.
 * A crawl whose browser cannot be started still writes its statistics file.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        RunConfig config;
        try {
            config = RunConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        System.exit(run(config));
    }

    static int run(RunConfig config) {
        return run(config, () -> new PlaywrightPageRenderer(config.headless()));
    }

    static int run(RunConfig config, Supplier<PageRendererInterface> rendererFactory) {
        logger.info("Running in {} mode (output format {}, HDFS {})", config.mode(), config.outputFormat(),
            config.hdfsEnabled() ? config.hdfsUrl() + config.hdfsPath() : "disabled");
        switch (config.mode()) {
            case ETL:
                return runPipeline(config, new FolderCaptureSource(config.inputFolder()));
            case SCRAPE:
                return runScrapeOnly(config, rendererFactory);
            case CRAWL:
            default:
                return runCrawlPipeline(config, rendererFactory);
        }
    }

    private static int runScrapeOnly(RunConfig config, Supplier<PageRendererInterface> rendererFactory) {
        CaptureArchive archive = new CaptureArchive(config.inputFolder());
        try (PageRendererInterface renderer = rendererFactory.get()) {
            CrawlStateMachine crawler = new CrawlStateMachine(renderer, config, archive::save);
            CaptureBatch batch = crawler.crawl();
            logger.info("Scrape finished in state {} with {} page(s) saved to {}", crawler.getState(),
                batch.captures().size(), archive.getFolder());
            batch.errors().forEach(e -> logger.warn("Scrape problem: {}", e));
            return batch.aborted() ? 1 : 0;
        } catch (RendererException e) {
            logger.error("Browser could not be started: {}", e.getMessage());
            return 1;
        }
    }

    private static int runCrawlPipeline(RunConfig config, Supplier<PageRendererInterface> rendererFactory) {
        CaptureArchive archive = new CaptureArchive(config.inputFolder());
        PageRendererInterface renderer;
        try {
            renderer = rendererFactory.get();
        } catch (RendererException e) {
            logger.error("Browser could not be started: {}", e.getMessage());
            return runPipeline(config, unavailableBrowser(config, e));
        }
        try (PageRendererInterface active = renderer) {
            return runPipeline(config, new CrawlStateMachine(active, config, archive::save));
        }
    }

    /**
     * Capture source standing in for a crawl whose browser never started: aborted, no pages.
     */
    private static CaptureSourceInterface unavailableBrowser(RunConfig config, RendererException cause) {
        return new CaptureSourceInterface() {
            @Override
            public CaptureBatch readCaptures() {
                return new CaptureBatch(List.of(), true, List.of("Browser could not be started: " + cause.getMessage()));
            }

            @Override
            public String describe() {
                return config.portalUrl();
            }
        };
    }

    private static int runPipeline(RunConfig config, CaptureSourceInterface source) {
        StorageClientInterface storage = config.hdfsEnabled()
            ? new StorageClient(new WebHdfsClient(config.hdfsUrl(), config.hdfsUser()))
            : new StorageClient();
        JournalSerializer serializer = new JournalSerializer();
        List<SinkWriterInterface> sinks = PipelineOrchestrator.configuredSinks(config, storage, serializer);
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(config, source,
            new PageTransformer(new JournalExtractor()), sinks, storage, serializer, Clock.systemDefaultZone());
        RunReport report = orchestrator.run();
        return report.aborted() ? 1 : 0;
    }
}
