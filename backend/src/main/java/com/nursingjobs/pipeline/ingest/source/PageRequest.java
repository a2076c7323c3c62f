package com.nursingjobs.pipeline.ingest.source;

public record PageRequest(
    int pageNumber,
    String url,
    String body
) {
}
