package com.nursingjobs.pipeline.ingest.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
}
