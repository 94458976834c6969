package com.sintajournals.scraper;

/**
 * Raised by a {@link PageRendererInterface} when it cannot navigate or interact with the page.
 * Wait timeouts are not exceptions; they are reported as {@code false} results.
 */
public class RendererException extends RuntimeException {
    public RendererException(String message) {
        super(message);
    }

    public RendererException(String message, Throwable cause) {
        super(message, cause);
    }
}
