package com.nursingjobs.pipeline.ingest.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record JobView(
    String slug,
    String title,
    String employerName,
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
    String sourceUrl
) {
}
