package com.nursingjobs.pipeline.ingest.model;

/**
 * Fields assigned by the classifier. {@code specialty} is always from the closed vocabulary.
 */
public record Classification(
    String specialty,
    String jobType,
    String shiftType,
    String experienceLevel,
    Double confidence
) {
}
