package com.sintajournals.scraper;

/**
 * Interface for anything that yields raw page captures to the {@link PipelineOrchestrator}.
 */
public interface CaptureSourceInterface {
    /**
     * Produces all captures of this source. Implementations report failures through the
     * returned batch instead of throwing.
     */
    CaptureBatch readCaptures();

    /**
     * @return where the captures come from, recorded as {@code source_folder} in the JSON artifact
     */
    String describe();
}
