package com.nursingjobs.pipeline.ingest.normalize;

import java.util.Locale;
import java.util.Map;

public final class JobTypeNormalizer {
    private static final Map<String, String> TYPES = Map.ofEntries(
        Map.entry("full-time", "full-time"),
        Map.entry("fulltime", "full-time"),
        Map.entry("full time", "full-time"),
        Map.entry("ft", "full-time"),
        Map.entry("f/t", "full-time"),
        Map.entry("regular full time", "full-time"),
        Map.entry("part-time", "part-time"),
        Map.entry("parttime", "part-time"),
        Map.entry("part time", "part-time"),
        Map.entry("pt", "part-time"),
        Map.entry("p/t", "part-time"),
        Map.entry("regular part time", "part-time"),
        Map.entry("prn", "per-diem"),
        Map.entry("per diem", "per-diem"),
        Map.entry("per-diem", "per-diem"),
        Map.entry("perdiem", "per-diem"),
        Map.entry("contract", "contract"),
        Map.entry("temporary", "contract"),
        Map.entry("temp", "contract"),
        Map.entry("seasonal", "contract"),
        Map.entry("travel", "travel")
    );

    private JobTypeNormalizer() {
    }

    /**
     * Canonical employment type ({@code full-time}, {@code part-time}, {@code per-diem},
     * {@code contract}, {@code travel}) or null when unrecognised.
     */
    public static String normalize(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.toLowerCase(Locale.ROOT).replace('_', ' ').replaceAll("\\s+", " ").trim();
        String direct = TYPES.get(value);
        if (direct != null) {
            return direct;
        }
        if (value.matches(".*\\bfull\\b.*")) {
            return "full-time";
        }
        if (value.matches(".*\\bpart\\b.*")) {
            return "part-time";
        }
        if (value.matches(".*\\b(prn|per diem)\\b.*")) {
            return "per-diem";
        }
        return null;
    }
}
