package com.sintajournals.scraper;

import java.util.Objects;

/**
 * Opaque handle to an element located by a {@link PageRendererInterface}.
 * The renderer resolves it to the first element matching {@code selector}.
 */
public record ElementRef(String selector) {
    public ElementRef {
        Objects.requireNonNull(selector, "selector");
    }
}
