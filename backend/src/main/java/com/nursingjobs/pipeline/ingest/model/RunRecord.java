package com.nursingjobs.pipeline.ingest.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record RunRecord(
    String runId,
    String employerSlug,
    Instant startedAt,
    Instant finishedAt,
    PipelineState finalState,
    StageStatus scrapeStatus,
    StageStatus classifyStatus,
    StageStatus announceStatus,
    int jobsFound,
    int inserted,
    int updated,
    int unchanged,
    int rejected,
    int classificationsSucceeded,
    int classificationsFailed,
    int outOfScope,
    BigDecimal estimatedCostUsd,
    List<String> announcedUrls,
    String errorMessage,
    Map<String, String> stageLogFiles
) {
    public boolean succeeded() {
        return finalState == PipelineState.DONE;
    }
}
