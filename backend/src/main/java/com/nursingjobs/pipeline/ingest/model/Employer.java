package com.nursingjobs.pipeline.ingest.model;

import java.time.Instant;

public record Employer(
    long id,
    String slug,
    String name,
    String careerPageUrl,
    Instant createdAt
) {
}
