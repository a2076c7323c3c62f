package com.nursingjobs.pipeline.ingest.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nursingjobs.pipeline.ingest.model.Classification;
import com.nursingjobs.pipeline.ingest.model.ClassifierVerdict;
import com.nursingjobs.pipeline.ingest.normalize.JobTypeNormalizer;
import com.nursingjobs.pipeline.ingest.normalize.SpecialtyVocabulary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates the classifier's JSON answer against the closed vocabularies. An unknown specialty
 * makes the whole answer unusable; unknown job, shift or experience values are dropped.
 */
@Component
public class ClassificationResponseParser {
    static final List<String> JOB_TYPES = List.of("Full Time", "Part Time", "PRN", "Per Diem", "Contract", "Travel");
    static final List<String> SHIFT_TYPES = List.of("days", "nights", "evenings", "variable", "rotating");
    static final List<String> EXPERIENCE_LEVELS = List.of("Entry Level", "New Grad", "Experienced", "Senior", "Leadership");

    private final ObjectMapper objectMapper;

    public ClassificationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClassifierVerdict parse(String content) {
        if (content == null || content.isBlank()) {
            throw new ClassificationFailureException("empty classifier answer");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFences(content));
        } catch (JsonProcessingException e) {
            throw new ClassificationFailureException("classifier answer is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationFailureException("classifier answer is not a JSON object");
        }
        JsonNode staffNode = root.get("isStaffRN");
        if (staffNode == null || !staffNode.isBoolean()) {
            throw new ClassificationFailureException("classifier answer lacks boolean isStaffRN");
        }
        boolean staffRn = staffNode.asBoolean();
        String rawSpecialty = text(root, "specialty");
        String specialty = SpecialtyVocabulary.canonical(rawSpecialty);
        if (staffRn && specialty == null) {
            throw new ClassificationFailureException("specialty '" + rawSpecialty + "' is not in the vocabulary");
        }
        Double confidence = root.hasNonNull("confidence") && root.get("confidence").isNumber()
            ? root.get("confidence").asDouble()
            : null;
        Classification classification = new Classification(
            specialty,
            JobTypeNormalizer.normalize(pick(JOB_TYPES, text(root, "jobType"))),
            pick(SHIFT_TYPES, text(root, "shiftType")),
            pick(EXPERIENCE_LEVELS, text(root, "experienceLevel")),
            confidence
        );
        return new ClassifierVerdict(staffRn, classification);
    }

    private static String pick(List<String> allowed, String value) {
        if (value == null) {
            return null;
        }
        for (String candidate : allowed) {
            if (candidate.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() || text.equalsIgnoreCase("null") ? null : text;
    }

    private static String stripFences(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstBrace = trimmed.indexOf('{');
            int lastBrace = trimmed.lastIndexOf('}');
            if (firstBrace >= 0 && lastBrace > firstBrace) {
                return trimmed.substring(firstBrace, lastBrace + 1);
            }
        }
        return trimmed;
    }
}
