package com.nursingjobs.pipeline.ingest.model;

public record NormalizationResult(
    NormalizedJob job,
    RejectedListing rejection
) {
    public static NormalizationResult accepted(NormalizedJob job) {
        return new NormalizationResult(job, null);
    }

    public static NormalizationResult rejected(RawListing listing, String reason) {
        return new NormalizationResult(null, new RejectedListing(listing, reason));
    }

    public boolean isAccepted() {
        return job != null;
    }
}
