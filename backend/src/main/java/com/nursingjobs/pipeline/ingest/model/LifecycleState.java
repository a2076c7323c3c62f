package com.nursingjobs.pipeline.ingest.model;

public enum LifecycleState {
    PENDING_CLASSIFICATION,
    ACTIVE,
    INACTIVE,
    DELETED;

    public boolean isVisible() {
        return this == ACTIVE;
    }
}
