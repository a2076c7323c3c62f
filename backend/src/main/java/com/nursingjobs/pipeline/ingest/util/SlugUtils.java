package com.nursingjobs.pipeline.ingest.util;

import java.net.URI;
import java.text.Normalizer;
import java.util.Locale;

public final class SlugUtils {
    private static final int MAX_TITLE_LENGTH = 50;
    private static final int MAX_SLUG_LENGTH = 100;

    private SlugUtils() {
    }

    public static String slugify(String value) {
        if (value == null) {
            return "";
        }
        String ascii = Normalizer.normalize(value, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return ascii.toLowerCase(Locale.ROOT)
            .replace("&", " and ")
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("(^-+|-+$)", "");
    }

    /**
     * Builds {@code title-city-state-id}. The title part is capped at 50 characters and the
     * whole slug at 100, never ending in a hyphen.
     */
    public static String jobSlug(String title, String city, String state, String uniqueSuffix) {
        String titlePart = truncate(slugify(title), MAX_TITLE_LENGTH);
        StringBuilder builder = new StringBuilder(titlePart);
        append(builder, slugify(city));
        append(builder, slugify(state));
        String suffix = slugify(uniqueSuffix);
        String base = truncate(builder.toString(), MAX_SLUG_LENGTH - (suffix.isEmpty() ? 0 : suffix.length() + 1));
        if (suffix.isEmpty()) {
            return base;
        }
        return base.isEmpty() ? truncate(suffix, MAX_SLUG_LENGTH) : base + "-" + suffix;
    }

    /**
     * Reduces a public job URL to its last path segment; plain slugs are returned as given.
     */
    public static String slugFromUrlOrSlug(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://") && !trimmed.contains("/")) {
            return trimmed;
        }
        String path = pathOf(trimmed);
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int idx = path.lastIndexOf('/');
        String slug = idx >= 0 ? path.substring(idx + 1) : path;
        return slug.isBlank() ? null : slug;
    }

    private static String pathOf(String value) {
        try {
            String path = URI.create(value).getPath();
            return path == null ? value : path;
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    private static void append(StringBuilder builder, String part) {
        if (part.isEmpty()) {
            return;
        }
        if (builder.length() > 0) {
            builder.append('-');
        }
        builder.append(part);
    }

    private static String truncate(String value, int max) {
        if (max <= 0) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max).replaceAll("-+$", "");
    }
}
