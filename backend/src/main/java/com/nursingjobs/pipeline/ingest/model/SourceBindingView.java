package com.nursingjobs.pipeline.ingest.model;

public record SourceBindingView(
    String slug,
    String name,
    String careerPageUrl,
    PaginationStrategy strategy,
    PageFormat format
) {
}
