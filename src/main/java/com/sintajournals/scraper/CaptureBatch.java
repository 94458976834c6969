package com.sintajournals.scraper;

import java.util.List;

/**
 * Captures produced by a {@link CaptureSourceInterface}, in sequence order.
 * @param captures captured pages
 * @param aborted true when the source stopped on an unrecoverable failure
 * @param errors human-readable problems met while producing the captures
 */
public record CaptureBatch(List<RawPageCapture> captures, boolean aborted, List<String> errors) {
    public CaptureBatch {
        captures = List.copyOf(captures);
        errors = List.copyOf(errors);
    }
}
