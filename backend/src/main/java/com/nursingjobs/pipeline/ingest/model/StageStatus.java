package com.nursingjobs.pipeline.ingest.model;

public enum StageStatus {
    NOT_RUN,
    SUCCEEDED,
    FAILED,
    SKIPPED
}
