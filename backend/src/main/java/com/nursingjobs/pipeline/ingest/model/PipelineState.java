package com.nursingjobs.pipeline.ingest.model;

public enum PipelineState {
    SCRAPE_PENDING,
    SCRAPING,
    SCRAPE_SUCCEEDED,
    SCRAPE_FAILED,
    CLASSIFYING,
    CLASSIFY_SUCCEEDED,
    CLASSIFY_FAILED,
    ANNOUNCING,
    DONE;

    public boolean isTerminal() {
        return this == SCRAPE_FAILED || this == CLASSIFY_FAILED || this == DONE;
    }

    public boolean isFailure() {
        return this == SCRAPE_FAILED || this == CLASSIFY_FAILED;
    }
}
