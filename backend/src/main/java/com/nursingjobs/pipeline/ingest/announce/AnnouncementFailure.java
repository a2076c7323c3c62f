package com.nursingjobs.pipeline.ingest.announce;

public record AnnouncementFailure(
    String endpoint,
    int batchNumber,
    int urlCount,
    String reason
) {
}
