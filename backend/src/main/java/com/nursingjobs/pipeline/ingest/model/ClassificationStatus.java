package com.nursingjobs.pipeline.ingest.model;

public enum ClassificationStatus {
    CLASSIFIED,
    OUT_OF_SCOPE,
    FAILED
}
