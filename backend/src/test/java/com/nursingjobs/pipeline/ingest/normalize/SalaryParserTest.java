package com.nursingjobs.pipeline.ingest.normalize;

import com.nursingjobs.pipeline.ingest.model.SalaryRange;
import com.nursingjobs.pipeline.ingest.model.SalaryType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class SalaryParserTest {

    @Test
    void parsesHourlyRangeWithKeyword() {
        SalaryRange range = SalaryParser.parse("$38.50 - $52.00 per hour");

        assertThat(range.min()).isEqualByComparingTo("38.50");
        assertThat(range.max()).isEqualByComparingTo("52.00");
        assertThat(range.type()).isEqualTo(SalaryType.HOURLY);
    }

    @Test
    void parsesAnnualRangeWithThousandsSuffix() {
        SalaryRange range = SalaryParser.parse("$85k to $110k");

        assertThat(range.min()).isEqualByComparingTo("85000");
        assertThat(range.max()).isEqualByComparingTo("110000");
        assertThat(range.type()).isEqualTo(SalaryType.ANNUAL);
    }

    @Test
    void infersTypeFromMagnitudeWithoutKeywords() {
        assertThat(SalaryParser.parse("$72,000 - $95,000").type()).isEqualTo(SalaryType.ANNUAL);
        assertThat(SalaryParser.parse("$41 - $58").type()).isEqualTo(SalaryType.HOURLY);
    }

    @Test
    void singleValueBecomesMinAndMax() {
        SalaryRange range = SalaryParser.parse("Starting at $45/hr");

        assertThat(range.min()).isEqualByComparingTo("45");
        assertThat(range.max()).isEqualByComparingTo("45");
        assertThat(range.type()).isEqualTo(SalaryType.HOURLY);
    }

    @Test
    void dropsHourlyValuesAboveCeiling() {
        SalaryRange range = SalaryParser.parse("$900 - $1,200 per hour");

        assertThat(range.isEmpty()).isTrue();
    }

    @Test
    void dropsAnnualValuesBelowFloor() {
        assertThat(SalaryParser.parse("$5,000 per year").isEmpty()).isTrue();
    }

    @Test
    void plausibilityBoundsAreInclusive() {
        assertThat(SalaryParser.isPlausible(SalaryType.HOURLY, new BigDecimal("10"), new BigDecimal("500"))).isTrue();
        assertThat(SalaryParser.isPlausible(SalaryType.HOURLY, new BigDecimal("9.99"), new BigDecimal("20"))).isFalse();
        assertThat(SalaryParser.isPlausible(SalaryType.ANNUAL, new BigDecimal("20000"), new BigDecimal("1000000"))).isTrue();
    }

    @Test
    void returnsEmptyForTextWithoutAmounts() {
        assertThat(SalaryParser.parse("Competitive pay and benefits").isEmpty()).isTrue();
        assertThat(SalaryParser.parse(null).isEmpty()).isTrue();
    }
}
