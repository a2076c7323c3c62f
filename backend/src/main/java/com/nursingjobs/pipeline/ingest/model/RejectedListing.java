package com.nursingjobs.pipeline.ingest.model;

public record RejectedListing(
    RawListing listing,
    String reason
) {
}
