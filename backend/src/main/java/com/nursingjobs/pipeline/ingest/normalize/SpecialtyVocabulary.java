package com.nursingjobs.pipeline.ingest.normalize;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The closed specialty vocabulary plus keyword rules that infer a specialty from a title or
 * description. Rules are ordered: multi-specialty first, then specific units before broad ones.
 */
public final class SpecialtyVocabulary {
    public static final List<String> SPECIALTIES = List.of(
        "Ambulatory",
        "Cardiac",
        "ER",
        "Float Pool",
        "General Nursing",
        "Geriatrics",
        "Home Care",
        "Home Health",
        "Hospice",
        "ICU",
        "Labor & Delivery",
        "Maternity",
        "Med-Surg",
        "Mental Health",
        "NICU",
        "Oncology",
        "OR",
        "PACU",
        "Pediatrics",
        "Progressive Care",
        "Radiology",
        "Rehabilitation",
        "Telemetry",
        "Travel"
    );

    private static final Pattern FLOAT = Pattern.compile(
        "float|all[ -]specialt(?:y|ies)|all specialit(?:y|ies)|multi-specialty|multiple specialties|various specialties"
    );

    private static final List<Rule> TITLE_RULES = List.of(
        new Rule("Labor & Delivery", "labor and delivery|labor & delivery|\\bl\\s*&\\s*d\\b"),
        new Rule("Maternity", "maternity|postpartum|mother baby|newborn nursery"),
        new Rule("NICU", "nicu|neonatal intensive care"),
        new Rule("PACU", "pacu|post-?anesthesia|post anesthesia|recovery room"),
        new Rule("OR", "operating room|perioperative|\\bor nurse\\b|\\bor\\s+registered\\s+nurse|\\bor\\s+rn\\b"),
        new Rule("Progressive Care", "progressive care|step[ -]?down|\\bpcu\\b"),
        new Rule("ICU", "intensive care|\\bicu\\b|critical care"),
        new Rule("ER", "emergency|\\ber nurse\\b|\\ber\\s+rn\\b"),
        new Rule("Radiology", "radiology"),
        new Rule("Oncology", "oncology|cancer"),
        new Rule("Cardiac", "cardiac|cardiology|cardiovascular"),
        new Rule("Telemetry", "telemetry"),
        new Rule("Med-Surg", "med-surg|medical surgical|medical-surgical|med surg|medsurg"),
        new Rule("Pediatrics", "pediatric|\\bpeds\\b"),
        new Rule("Geriatrics", "geriatric"),
        new Rule("Mental Health", "mental health|psychiatric|\\bpsych\\b|behavioral health"),
        new Rule("Rehabilitation", "rehab"),
        new Rule("Ambulatory", "ambulatory"),
        new Rule("Home Care", "home care|homecare"),
        new Rule("Home Health", "home health"),
        new Rule("Hospice", "hospice|palliative"),
        new Rule("Travel", "travel")
    );

    // Emergency and critical care are checked before neonatal units so that a passing mention
    // of "NICU transfers" in an ER posting does not win.
    private static final List<Rule> TEXT_RULES = List.of(
        new Rule("ER", "emergency room|emergency department|emergency dept|emergency nursing"),
        new Rule("ICU", "intensive care|\\bicu\\b|critical care unit"),
        new Rule("Labor & Delivery", "labor and delivery|labor & delivery|\\bl\\s*&\\s*d\\b"),
        new Rule("Maternity", "maternity|postpartum|newborn nursery"),
        new Rule("NICU", "nicu|neonatal intensive care"),
        new Rule("PACU", "pacu|post-anesthesia|recovery room"),
        new Rule("Progressive Care", "progressive care|step[ -]?down|\\bpcu\\b"),
        new Rule("Radiology", "radiology"),
        new Rule("Oncology", "oncology|cancer care"),
        new Rule("Cardiac", "cardiac|cardiology"),
        new Rule("Telemetry", "telemetry"),
        new Rule("Med-Surg", "med-surg|medical surgical|med surg"),
        new Rule("Pediatrics", "pediatric"),
        new Rule("Geriatrics", "geriatric"),
        new Rule("Mental Health", "mental health|psychiatric|behavioral health"),
        new Rule("Rehabilitation", "rehab"),
        new Rule("Ambulatory", "ambulatory"),
        new Rule("Home Care", "home care|homecare"),
        new Rule("Home Health", "home health"),
        new Rule("Hospice", "hospice|palliative"),
        new Rule("Travel", "travel")
    );

    private SpecialtyVocabulary() {
    }

    /**
     * The vocabulary entry matching {@code value} ignoring case, or null.
     */
    public static String canonical(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (String specialty : SPECIALTIES) {
            if (specialty.equalsIgnoreCase(trimmed)) {
                return specialty;
            }
        }
        return null;
    }

    public static boolean contains(String value) {
        return canonical(value) != null;
    }

    /**
     * Infers a specialty from title (preferred) then department and description. Returns null
     * when nothing is directly inferable.
     */
    public static String detect(String title, String department, String description) {
        String titleLower = lower(title);
        if (FLOAT.matcher(titleLower).find()) {
            return "Float Pool";
        }
        String match = firstMatch(TITLE_RULES, titleLower);
        if (match != null) {
            return match;
        }
        String departmentMatch = firstMatch(TITLE_RULES, lower(department));
        if (departmentMatch != null) {
            return departmentMatch;
        }
        String text = lower(description);
        if (FLOAT.matcher(text).find()) {
            return "Float Pool";
        }
        return firstMatch(TEXT_RULES, text);
    }

    private static String firstMatch(List<Rule> rules, String text) {
        if (text.isEmpty()) {
            return null;
        }
        for (Rule rule : rules) {
            if (rule.pattern().matcher(text).find()) {
                return rule.specialty();
            }
        }
        return null;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private record Rule(String specialty, Pattern pattern) {
        Rule(String specialty, String regex) {
            this(specialty, Pattern.compile(regex));
        }
    }
}
