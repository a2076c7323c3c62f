package com.nursingjobs.pipeline.ingest.model;

public record ClassificationOutcome(
    long jobId,
    ClassificationStatus status,
    Classification classification,
    String failureReason
) {
    public static ClassificationOutcome classified(long jobId, Classification classification) {
        return new ClassificationOutcome(jobId, ClassificationStatus.CLASSIFIED, classification, null);
    }

    public static ClassificationOutcome outOfScope(long jobId) {
        return new ClassificationOutcome(jobId, ClassificationStatus.OUT_OF_SCOPE, null, null);
    }

    public static ClassificationOutcome failed(long jobId, String reason) {
        return new ClassificationOutcome(jobId, ClassificationStatus.FAILED, null, reason);
    }
}
