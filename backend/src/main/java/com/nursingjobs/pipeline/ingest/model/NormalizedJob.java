package com.nursingjobs.pipeline.ingest.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record NormalizedJob(
    String identityKey,
    long employerId,
    String employerSlug,
    String title,
    String slug,
    String city,
    String state,
    String specialtyHint,
    String jobType,
    BigDecimal salaryMin,
    BigDecimal salaryMax,
    SalaryType salaryType,
    LocalDate postedDate,
    String sourceUrl,
    String department,
    String description,
    String contentHash
) {
}
