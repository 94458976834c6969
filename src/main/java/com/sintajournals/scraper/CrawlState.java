package com.sintajournals.scraper;

/**
 * States of the {@link CrawlStateMachine}. {@link #DONE} and {@link #ABORTED} are terminal.
 */
public enum CrawlState {
    INITIALIZING,
    FILTER_APPLIED,
    PAGE_CAPTURED,
    ADVANCING,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
