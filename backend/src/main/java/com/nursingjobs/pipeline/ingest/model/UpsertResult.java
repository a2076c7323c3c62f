package com.nursingjobs.pipeline.ingest.model;

public record UpsertResult(
    UpsertOutcome outcome,
    JobRecord record
) {
}
