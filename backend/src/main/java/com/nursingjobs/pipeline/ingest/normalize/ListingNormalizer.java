package com.nursingjobs.pipeline.ingest.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nursingjobs.pipeline.ingest.model.Employer;
import com.nursingjobs.pipeline.ingest.model.NormalizationResult;
import com.nursingjobs.pipeline.ingest.model.NormalizedJob;
import com.nursingjobs.pipeline.ingest.model.RawListing;
import com.nursingjobs.pipeline.ingest.model.SalaryRange;
import com.nursingjobs.pipeline.ingest.util.HashUtils;
import com.nursingjobs.pipeline.ingest.util.SlugUtils;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a {@link RawListing} onto the canonical job shape. Listings without a title or a
 * location are rejected with a reason; everything else is best-effort.
 */
@Component
public class ListingNormalizer {
    private static final Pattern TITLE_JOB_TYPE =
        Pattern.compile("(?i)\\b(PRN|Per Diem|Part[- ]Time|Full[- ]Time)\\b");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ListingNormalizer(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public NormalizationResult normalize(RawListing listing, Employer employer) {
        if (employer == null) {
            return NormalizationResult.rejected(listing, "missing employer");
        }
        String title = clean(listing.title());
        if (title == null) {
            return NormalizationResult.rejected(listing, "missing title");
        }
        String location = clean(listing.location());
        if (location == null) {
            return NormalizationResult.rejected(listing, "missing location");
        }

        ParsedLocation parsed = LocationParser.parse(location);
        SalaryRange salary = SalaryParser.parse(listing.salaryText());
        LocalDate postedDate = PostedDateParser.parse(listing.postedDateText(), LocalDate.now(clock));
        String description = plainText(listing.description());
        String jobType = JobTypeNormalizer.normalize(listing.employmentType());
        if (jobType == null) {
            Matcher titleType = TITLE_JOB_TYPE.matcher(title);
            if (titleType.find()) {
                jobType = JobTypeNormalizer.normalize(titleType.group(1));
            }
        }
        String specialtyHint = SpecialtyVocabulary.detect(title, listing.department(), description);

        String identityKey = IdentityKeys.of(
            employer.slug(),
            listing.externalId(),
            title,
            location,
            postedDate == null || PostedDateParser.isOpenEnded(listing.postedDateText()) ? null : postedDate.toString()
        );
        String suffix = listing.externalId() != null && !listing.externalId().isBlank()
            ? listing.externalId()
            : identityKey.substring(0, 10);
        String slug = SlugUtils.jobSlug(title, parsed.city(), parsed.state(), suffix);

        Map<String, String> stableFields = new TreeMap<>();
        stableFields.put("title", title);
        stableFields.put("city", blankToEmpty(parsed.city()));
        stableFields.put("state", blankToEmpty(parsed.state()));
        stableFields.put("job_type", blankToEmpty(jobType));
        stableFields.put("salary_min", amount(salary.min()));
        stableFields.put("salary_max", amount(salary.max()));
        stableFields.put("salary_type", salary.type() == null ? "" : salary.type().name());
        stableFields.put("posted_date", postedDate == null ? "" : postedDate.toString());
        stableFields.put("source_url", blankToEmpty(listing.url()));
        stableFields.put("department", blankToEmpty(listing.department()));
        stableFields.put("description", blankToEmpty(description));

        return NormalizationResult.accepted(new NormalizedJob(
            identityKey,
            employer.id(),
            employer.slug(),
            title,
            slug,
            parsed.city(),
            parsed.state(),
            specialtyHint,
            jobType,
            salary.min(),
            salary.max(),
            salary.type(),
            postedDate,
            clean(listing.url()),
            clean(listing.department()),
            description,
            HashUtils.sha256Hex(hashPayload(stableFields))
        ));
    }

    private String hashPayload(Map<String, String> stableFields) {
        try {
            return objectMapper.writeValueAsString(stableFields);
        } catch (JsonProcessingException e) {
            return stableFields.toString();
        }
    }

    private static String plainText(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.contains("<") ? Jsoup.parse(value).text() : value;
        return clean(text);
    }

    private static String amount(BigDecimal value) {
        return value == null ? "" : value.stripTrailingZeros().toPlainString();
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.replace(' ', ' ').replaceAll("\\s+", " ").trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String blankToEmpty(String value) {
        return value == null ? "" : value;
    }
}
