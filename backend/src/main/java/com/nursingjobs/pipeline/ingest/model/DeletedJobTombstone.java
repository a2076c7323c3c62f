package com.nursingjobs.pipeline.ingest.model;

import java.time.Instant;

public record DeletedJobTombstone(
    String slug,
    String reason,
    Instant createdAt
) {
}
