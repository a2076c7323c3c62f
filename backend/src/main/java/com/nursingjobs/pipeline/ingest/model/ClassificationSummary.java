package com.nursingjobs.pipeline.ingest.model;

import java.math.BigDecimal;
import java.util.List;

public record ClassificationSummary(
    int attempted,
    int succeeded,
    int outOfScope,
    int failed,
    BigDecimal estimatedCostUsd,
    List<JobRecord> activated
) {
    public boolean allAttemptsFailed() {
        return attempted > 0 && failed == attempted;
    }
}
