package com.nursingjobs.pipeline.ingest.classify;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.JobRecord;
import com.nursingjobs.pipeline.ingest.normalize.SpecialtyVocabulary;
import org.springframework.stereotype.Component;

@Component
public class ClassificationPromptBuilder {
    static final String SYSTEM_PROMPT = "You classify nursing job postings. Respond with one JSON object only.";

    private static final String TEMPLATE = """
        Classify this job posting.

        Title: %s
        Employer: %s
        Location: %s
        Description: %s

        1. isStaffRN: true when the role needs only an RN license (staff, charge, unit leadership roles \
        included); false for advanced practice roles (NP, CRNA, CNS, CNM) and for non-RN roles (LPN, LVN, CNA, MA).
        2. specialty: exactly one of: %s. Use "Float Pool" only for float or multi-unit roles and \
        "General Nursing" only when no unit can be determined.
        3. jobType: one of %s, or null.
        4. shiftType: one of %s, or null.
        5. experienceLevel: one of %s, or null.

        Use only the listed values. Answer as:
        {"isStaffRN": true, "specialty": "...", "jobType": null, "shiftType": null, "experienceLevel": null, "confidence": 0.9}
        """;

    private final PipelineProperties properties;

    public ClassificationPromptBuilder(PipelineProperties properties) {
        this.properties = properties;
    }

    public String build(JobRecord job, String employerName) {
        return TEMPLATE.formatted(
            orNa(job.title()),
            orNa(employerName),
            location(job),
            preview(job.description()),
            String.join(", ", SpecialtyVocabulary.SPECIALTIES),
            String.join(", ", ClassificationResponseParser.JOB_TYPES),
            String.join(", ", ClassificationResponseParser.SHIFT_TYPES),
            String.join(", ", ClassificationResponseParser.EXPERIENCE_LEVELS)
        );
    }

    private String preview(String description) {
        if (description == null || description.isBlank()) {
            return "N/A";
        }
        int max = properties.getClassification().getMaxDescriptionChars();
        return description.length() <= max ? description : description.substring(0, max);
    }

    private static String location(JobRecord job) {
        if (job.city() == null && job.state() == null) {
            return "N/A";
        }
        if (job.city() == null) {
            return job.state();
        }
        return job.state() == null ? job.city() : job.city() + ", " + job.state();
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }
}
