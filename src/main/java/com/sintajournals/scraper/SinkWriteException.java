package com.sintajournals.scraper;

/**
 * Raised by a {@link SinkWriterInterface} when its destination could not be written.
 */
public class SinkWriteException extends Exception {
    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
