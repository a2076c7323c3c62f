package com.nursingjobs.pipeline.ingest.model;

public enum SalaryType {
    HOURLY,
    ANNUAL
}
