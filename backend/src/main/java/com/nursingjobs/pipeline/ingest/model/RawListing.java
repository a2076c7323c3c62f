package com.nursingjobs.pipeline.ingest.model;

/**
 * One listing as read from a source page, before any normalization.
 */
public record RawListing(
    String employerSlug,
    String externalId,
    String title,
    String location,
    String url,
    String postedDateText,
    String salaryText,
    String department,
    String employmentType,
    String description
) {
}
