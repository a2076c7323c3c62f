package com.nursingjobs.pipeline.ingest.model;

/**
 * Validated response of one classification call.
 */
public record ClassifierVerdict(
    boolean staffRn,
    Classification classification
) {
}
