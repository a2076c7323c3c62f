package com.nursingjobs.pipeline.ingest.model;

import java.math.BigDecimal;

public record SalaryRange(
    BigDecimal min,
    BigDecimal max,
    SalaryType type
) {
    public static SalaryRange empty() {
        return new SalaryRange(null, null, null);
    }

    public boolean isEmpty() {
        return min == null && max == null;
    }
}
