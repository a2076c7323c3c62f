package com.nursingjobs.pipeline.ingest.announce;

import java.util.List;

public record AnnouncementSummary(
    boolean skipped,
    int batches,
    List<String> submittedUrls,
    List<AnnouncementFailure> failures
) {
    public static AnnouncementSummary notSubmitted() {
        return new AnnouncementSummary(true, 0, List.of(), List.of());
    }
}
