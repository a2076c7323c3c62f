package com.nursingjobs.pipeline.ingest.normalize;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Posted dates come as ISO dates, US dates, long-form dates or relative phrases
 * ("Posted 3 Days Ago", "Posted Today", "30+ days ago").
 */
public final class PostedDateParser {
    private static final Pattern DAYS_AGO = Pattern.compile("(\\d+)\\+?\\s+days?\\s+ago");
    private static final Pattern OPEN_ENDED = Pattern.compile("\\d+\\+\\s+days?\\s+ago");
    private static final int MAX_DAYS_AGO_DIGITS = 5;
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final List<DateTimeFormatter> FORMATS = List.of(
        DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US),
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US),
        DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US),
        DateTimeFormatter.ofPattern("d MMM yyyy", Locale.US)
    );

    private PostedDateParser() {
    }

    public static LocalDate parse(String text, LocalDate today) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.contains("today") || lower.contains("just posted")) {
            return today;
        }
        if (lower.contains("yesterday")) {
            return today.minusDays(1);
        }
        Matcher daysAgo = DAYS_AGO.matcher(lower);
        if (daysAgo.find()) {
            String days = daysAgo.group(1);
            return days.length() > MAX_DAYS_AGO_DIGITS ? null : today.minusDays(Long.parseLong(days));
        }
        LocalDate timestamp = parseTimestamp(value);
        if (timestamp != null) {
            return timestamp;
        }
        Matcher iso = ISO_DATE.matcher(value);
        if (iso.find()) {
            return parseWith(iso.group(), DateTimeFormatter.ISO_LOCAL_DATE);
        }
        String cleaned = value.replaceFirst("(?i)^posted( on)?:?\\s*", "");
        for (DateTimeFormatter format : FORMATS) {
            LocalDate parsed = parseWith(cleaned, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * True for lower bounds such as "30+ days ago", whose parsed date moves with the calendar.
     */
    public static boolean isOpenEnded(String text) {
        return text != null && OPEN_ENDED.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    private static LocalDate parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toLocalDate();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value).atZone(ZoneOffset.UTC).toLocalDate();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static LocalDate parseWith(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
