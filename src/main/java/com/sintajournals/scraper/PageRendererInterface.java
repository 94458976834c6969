package com.sintajournals.scraper;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for the browser capability driven by the {@link CrawlStateMachine}.
 * <p>
 * All operations are fallible I/O. Navigation and interaction failures are raised as
 * {@link RendererException}; waiting for an element that never appears returns {@code false}.
 * The renderer is a single stateful resource and must not be driven from two threads.
 */
public interface PageRendererInterface extends AutoCloseable {
    /**
     * Loads the given URL in the current page.
     * @param url absolute URL
     * @throws RendererException if navigation fails
     */
    void navigate(String url);

    /**
     * Waits until an element matching the selector is present.
     * @param selector renderer selector
     * @param timeout maximum wait
     * @return true if the element appeared, false on timeout
     */
    boolean waitForElement(String selector, Duration timeout);

    /**
     * Clicks the referenced element.
     * @throws RendererException if the element cannot be clicked
     */
    void click(ElementRef element);

    /**
     * @return the current rendered markup of the page
     */
    String currentMarkup();

    /**
     * Looks up the first element matching the selector without waiting.
     * @return a reference, or empty if no element matches
     */
    Optional<ElementRef> findElement(String selector);

    /**
     * Reads the attributes of the referenced element. Besides the markup attributes the map
     * carries the pseudo-attributes {@code checked} ("true"/"false") and {@code text}.
     */
    Map<String, String> elementAttributes(ElementRef element);

    /**
     * Saves a screenshot of the current page.
     * @return true if the screenshot was written
     */
    boolean saveScreenshot(Path path);

    @Override
    void close();
}
