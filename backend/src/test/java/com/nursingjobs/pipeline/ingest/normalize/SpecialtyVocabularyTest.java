package com.nursingjobs.pipeline.ingest.normalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpecialtyVocabularyTest {

    @Test
    void titleRulesWinOverDescription() {
        String specialty = SpecialtyVocabulary.detect(
            "Registered Nurse - NICU",
            null,
            "Our emergency department partners closely with the unit."
        );

        assertThat(specialty).isEqualTo("NICU");
    }

    @Test
    void floatPoolBeatsUnitKeywords() {
        assertThat(SpecialtyVocabulary.detect("RN Float Pool - ICU/Telemetry", null, null)).isEqualTo("Float Pool");
    }

    @Test
    void fallsBackToDepartmentThenDescription() {
        assertThat(SpecialtyVocabulary.detect("Registered Nurse", "Cardiology Services", null)).isEqualTo("Cardiac");
        assertThat(SpecialtyVocabulary.detect("Registered Nurse", null, "Join our emergency department team"))
            .isEqualTo("ER");
    }

    @Test
    void returnsNullWhenNothingIsInferable() {
        assertThat(SpecialtyVocabulary.detect("Registered Nurse", null, "Great benefits.")).isNull();
    }

    @Test
    void canonicalMatchesIgnoringCase() {
        assertThat(SpecialtyVocabulary.canonical("med-surg")).isEqualTo("Med-Surg");
        assertThat(SpecialtyVocabulary.contains("Dermatology")).isFalse();
        assertThat(SpecialtyVocabulary.SPECIALTIES).hasSize(24);
    }
}
