package com.sintajournals.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Drives a {@link PageRendererInterface} through the filtered, paginated journal listing.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@code INITIALIZING}: open the portal, open the filter modal, tick the accreditation
 *       filter if it is not already ticked, submit, and wait for the results table.</li>
 *   <li>{@code FILTER_APPLIED -> PAGE_CAPTURED}: capture the first page.</li>
 *   <li>{@code PAGE_CAPTURED}: look for the "Next" pagination link. A missing link, or one that
 *       is disabled (class, {@code aria-disabled}, empty or {@code javascript:} href) ends the
 *       crawl in {@code DONE}. So does reaching the configured page cap.</li>
 *   <li>{@code ADVANCING}: click "Next", wait for the results table, capture the next page.</li>
 *   <li>Any renderer failure ends the crawl in {@code ABORTED} after a best-effort attempt to
 *       save the current markup and a screenshot to the diagnostics folder.</li>
 * </ul>
 * Waits are bounded: when the results table does not appear in time, the crawl sleeps the
 * grace delay and carries on with whatever is rendered.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public class CrawlStateMachine implements CaptureSourceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CrawlStateMachine.class);

    static final String FILTER_TOGGLE = "button[data-target='#filterJournal']";
    static final String FILTER_MODAL = "#filterJournal";
    static final String ACCREDITATION_CHECKBOX = "#filter_accreditation1";
    static final String FILTER_SUBMIT = "button[name='filter_journals'][value='1']";
    static final String RESULTS_MARKER = "table.table";
    static final String NEXT_PAGE = "a.page-link:text-is(\"Next\")";

    private static final Duration CONTROL_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Blocking delay used for grace and settle waits.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final PageRendererInterface renderer;
    private final RunConfig config;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Consumer<RawPageCapture> captureListener;

    private final List<CrawlState> stateHistory = new ArrayList<>();
    private CrawlState state = CrawlState.INITIALIZING;

    public CrawlStateMachine(PageRendererInterface renderer, RunConfig config, Consumer<RawPageCapture> captureListener) {
        this(renderer, config, captureListener, d -> Thread.sleep(d.toMillis()), Clock.systemDefaultZone());
    }

    public CrawlStateMachine(PageRendererInterface renderer, RunConfig config, Consumer<RawPageCapture> captureListener,
                             Sleeper sleeper, Clock clock) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.config = Objects.requireNonNull(config, "config");
        this.captureListener = captureListener == null ? capture -> {} : captureListener;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        stateHistory.add(state);
    }

    @Override
    public String describe() {
        return config.portalUrl();
    }

    @Override
    public CaptureBatch readCaptures() {
        return crawl();
    }

    /**
     * Runs the crawl to a terminal state. Never throws; an unrecoverable failure is reported
     * through {@link CaptureBatch#aborted()}.
     */
    public CaptureBatch crawl() {
        if (state != CrawlState.INITIALIZING) {
            throw new IllegalStateException("Crawl already ran; current state " + state);
        }
        List<RawPageCapture> captures = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int sequence = 1;
        try {
            applyFilter();
            transition(CrawlState.FILTER_APPLIED);

            captures.add(capture(sequence, errors));
            transition(CrawlState.PAGE_CAPTURED);

            while (true) {
                if (sequence >= config.maxPages()) {
                    logger.warn("Reached max pages ({}). Stopping pagination.", config.maxPages());
                    break;
                }
                Optional<ElementRef> next = renderer.findElement(NEXT_PAGE);
                if (next.isEmpty()) {
                    logger.info("'Next' control not found. Reached the last page ({}).", sequence);
                    break;
                }
                if (!isNavigable(renderer.elementAttributes(next.get()))) {
                    logger.info("'Next' control is disabled on page {}. Stopping pagination.", sequence);
                    break;
                }

                transition(CrawlState.ADVANCING);
                logger.info("Clicking 'Next' to leave page {}", sequence);
                renderer.click(next.get());
                sleeper.sleep(config.settleDelay());
                awaitResults();

                sequence++;
                captures.add(capture(sequence, errors));
                transition(CrawlState.PAGE_CAPTURED);
            }
            transition(CrawlState.DONE);
            logger.info("Pagination finished after {} page(s).", captures.size());
            return new CaptureBatch(captures, false, errors);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return abort(captures, errors, "Crawl interrupted in state " + state);
        } catch (RuntimeException e) {
            return abort(captures, errors, "Crawl aborted in state " + state + ": " + e.getMessage());
        }
    }

    private void applyFilter() throws InterruptedException {
        renderer.navigate(config.portalUrl());

        ElementRef toggle = requireElement(FILTER_TOGGLE, "filter toggle");
        renderer.click(toggle);
        logger.info("Filter modal opened");
        if (!renderer.waitForElement(FILTER_MODAL, config.waitTimeout())) {
            logger.warn("Filter modal did not appear in time; continuing.");
        }

        ElementRef checkbox = requireElement(ACCREDITATION_CHECKBOX, "accreditation checkbox");
        if ("true".equalsIgnoreCase(renderer.elementAttributes(checkbox).get("checked"))) {
            logger.info("Accreditation filter already selected");
        } else {
            renderer.click(checkbox);
            logger.info("Accreditation filter selected");
        }

        renderer.click(requireElement(FILTER_SUBMIT, "filter submit button"));
        logger.info("Filter submitted");
        awaitResults();
    }

    private ElementRef requireElement(String selector, String description) {
        renderer.waitForElement(selector, CONTROL_TIMEOUT);
        return renderer.findElement(selector)
            .orElseThrow(() -> new RendererException("Required " + description + " not found: " + selector));
    }

    private void awaitResults() throws InterruptedException {
        if (!renderer.waitForElement(RESULTS_MARKER, config.waitTimeout())) {
            logger.warn("Results table did not appear within {}s; waiting {}s grace delay.",
                config.waitTimeout().toSeconds(), config.graceDelay().toSeconds());
            sleeper.sleep(config.graceDelay());
        }
    }

    private RawPageCapture capture(int sequence, List<String> errors) {
        RawPageCapture capture = new RawPageCapture(sequence, renderer.currentMarkup(), LocalDateTime.now(clock), config.portalUrl());
        logger.info("Captured page {}", sequence);
        try {
            captureListener.accept(capture);
        } catch (RuntimeException e) {
            String error = "Failed to archive page " + sequence + ": " + e.getMessage();
            logger.warn(error);
            errors.add(error);
        }
        return capture;
    }

    /**
     * Decides whether the "Next" control can be followed.
     * @param attributes attributes of the control
     * @return false when the control is disabled or has no navigable target
     */
    static boolean isNavigable(Map<String, String> attributes) {
        String cls = attributes.getOrDefault("class", "").toLowerCase(Locale.ROOT);
        String ariaDisabled = attributes.getOrDefault("aria-disabled", "").toLowerCase(Locale.ROOT);
        String href = attributes.get("href");
        if (cls.contains("disabled") || "true".equals(ariaDisabled)) return false;
        return href != null && !href.isBlank() && !href.trim().toLowerCase(Locale.ROOT).startsWith("javascript:");
    }

    private CaptureBatch abort(List<RawPageCapture> captures, List<String> errors, String message) {
        logger.error(message);
        errors.add(message);
        saveDiagnostics();
        transition(CrawlState.ABORTED);
        return new CaptureBatch(captures, true, errors);
    }

    private void saveDiagnostics() {
        String ts = Utils.fileTimestamp(LocalDateTime.now(clock));
        Path folder = config.diagnosticsFolder();
        try {
            Files.createDirectories(folder);
            Files.writeString(folder.resolve("exception_page_" + ts + ".html"), renderer.currentMarkup(), StandardCharsets.UTF_8);
            renderer.saveScreenshot(folder.resolve("exception_" + ts + ".png"));
            logger.info("Saved debug artifacts to {}", folder);
        } catch (Exception e) {
            logger.warn("Failed to save debug artifacts: {}", e.getMessage());
        }
    }

    private void transition(CrawlState next) {
        logger.debug("Crawl state {} -> {}", state, next);
        state = next;
        stateHistory.add(next);
    }

    public CrawlState getState() {
        return state;
    }

    public List<CrawlState> getStateHistory() {
        return Collections.unmodifiableList(stateHistory);
    }
}
