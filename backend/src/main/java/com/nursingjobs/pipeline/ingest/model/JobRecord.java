package com.nursingjobs.pipeline.ingest.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record JobRecord(
    long id,
    String identityKey,
    long employerId,
    String title,
    String slug,
    String city,
    String state,
    String specialty,
    String jobType,
    String shiftType,
    String experienceLevel,
    BigDecimal salaryMin,
    BigDecimal salaryMax,
    SalaryType salaryType,
    LocalDate postedDate,
    String sourceUrl,
    String description,
    String contentHash,
    LifecycleState lifecycleState,
    Instant classifiedAt,
    Instant createdAt,
    Instant updatedAt
) {
    public boolean isVisible() {
        return lifecycleState != null && lifecycleState.isVisible();
    }
}
