package com.nursingjobs.pipeline.ingest.model;

public enum PipelineEvent {
    START_SCRAPE,
    SCRAPE_OK,
    SCRAPE_ERROR,
    START_CLASSIFY,
    CLASSIFY_OK,
    CLASSIFY_ERROR,
    START_ANNOUNCE,
    ANNOUNCE_FINISHED
}
