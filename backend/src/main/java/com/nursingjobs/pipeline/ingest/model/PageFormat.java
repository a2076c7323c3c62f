package com.nursingjobs.pipeline.ingest.model;

public enum PageFormat {
    HTML,
    JSON
}
