package com.nursingjobs.pipeline.ingest.normalize;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits free-text locations such as {@code "Columbus, OH 43215"}, {@code "US-OH-Columbus"} or
 * {@code "Hartford, Connecticut"} into a capitalized city and a two-letter state code.
 */
public final class LocationParser {
    private static final Map<String, String> STATE_CODES = new HashMap<>();
    private static final Set<String> VALID_CODES = new HashSet<>();
    private static final Pattern ZIP = Pattern.compile("\\s*\\b\\d{5}(?:-\\d{4})?\\b\\s*$");
    private static final Pattern COUNTRY_STATE_CITY = Pattern.compile("^(?:US|USA)-([A-Za-z]{2})-(.+)$");
    private static final Pattern MULTI = Pattern.compile("(?i)^(\\d+\\s+locations|multiple locations|various locations)$");

    static {
        String[][] states = {
            {"alabama", "AL"}, {"alaska", "AK"}, {"arizona", "AZ"}, {"arkansas", "AR"},
            {"california", "CA"}, {"colorado", "CO"}, {"connecticut", "CT"}, {"delaware", "DE"},
            {"florida", "FL"}, {"georgia", "GA"}, {"hawaii", "HI"}, {"idaho", "ID"},
            {"illinois", "IL"}, {"indiana", "IN"}, {"iowa", "IA"}, {"kansas", "KS"},
            {"kentucky", "KY"}, {"louisiana", "LA"}, {"maine", "ME"}, {"maryland", "MD"},
            {"massachusetts", "MA"}, {"michigan", "MI"}, {"minnesota", "MN"}, {"mississippi", "MS"},
            {"missouri", "MO"}, {"montana", "MT"}, {"nebraska", "NE"}, {"nevada", "NV"},
            {"new hampshire", "NH"}, {"new jersey", "NJ"}, {"new mexico", "NM"}, {"new york", "NY"},
            {"north carolina", "NC"}, {"north dakota", "ND"}, {"ohio", "OH"}, {"oklahoma", "OK"},
            {"oregon", "OR"}, {"pennsylvania", "PA"}, {"rhode island", "RI"}, {"south carolina", "SC"},
            {"south dakota", "SD"}, {"tennessee", "TN"}, {"texas", "TX"}, {"utah", "UT"},
            {"vermont", "VT"}, {"virginia", "VA"}, {"washington", "WA"}, {"west virginia", "WV"},
            {"wisconsin", "WI"}, {"wyoming", "WY"}, {"district of columbia", "DC"},
            {"calif", "CA"}, {"conn", "CT"}, {"fla", "FL"}, {"mass", "MA"}, {"mich", "MI"},
            {"minn", "MN"}, {"tenn", "TN"}, {"tex", "TX"}, {"wash", "WA"}, {"wisc", "WI"}
        };
        for (String[] state : states) {
            STATE_CODES.put(state[0], state[1]);
            VALID_CODES.add(state[1]);
        }
    }

    private LocationParser() {
    }

    public static ParsedLocation parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedLocation.empty();
        }
        String value = raw.split("\\s*[|;]\\s*")[0].replaceAll("\\s+", " ").trim();
        if (MULTI.matcher(value).matches()) {
            return ParsedLocation.empty();
        }

        Matcher workday = COUNTRY_STATE_CITY.matcher(value);
        if (workday.matches()) {
            return new ParsedLocation(normalizeCity(workday.group(2)), normalizeState(workday.group(1)));
        }

        value = ZIP.matcher(value).replaceAll("");
        List<String> parts = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty() && !isCountry(trimmed)) {
                parts.add(trimmed);
            }
        }
        if (parts.isEmpty()) {
            return ParsedLocation.empty();
        }
        if (parts.size() == 1) {
            String only = parts.get(0);
            String state = normalizeState(only);
            if (state != null && (only.length() == 2 || STATE_CODES.containsKey(only.toLowerCase(Locale.ROOT)))) {
                return new ParsedLocation(null, state);
            }
            return new ParsedLocation(normalizeCity(only), null);
        }
        String state = normalizeState(parts.get(1));
        return new ParsedLocation(normalizeCity(parts.get(0)), state);
    }

    /**
     * Two-letter code for a state name, abbreviation or code; null when not recognised.
     */
    public static String normalizeState(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim().toLowerCase(Locale.ROOT).replace(".", "");
        if (value.length() == 2) {
            String code = value.toUpperCase(Locale.ROOT);
            return VALID_CODES.contains(code) ? code : null;
        }
        return STATE_CODES.get(value);
    }

    public static String normalizeCity(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        for (String word : input.trim().split("\\s+")) {
            String lower = word.toLowerCase(Locale.ROOT);
            String mapped = switch (lower.replace(".", "")) {
                case "st" -> "St.";
                case "ft" -> "Ft.";
                case "mt" -> "Mt.";
                default -> Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
            };
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(mapped);
        }
        return out.toString();
    }

    private static boolean isCountry(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.equals("us") || lower.equals("usa") || lower.equals("united states")
            || lower.equals("united states of america");
    }
}
