package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.ingest.model.ClassificationSummary;
import com.nursingjobs.pipeline.ingest.model.PipelineEvent;
import com.nursingjobs.pipeline.ingest.model.PipelineState;
import com.nursingjobs.pipeline.ingest.model.RunRecord;
import com.nursingjobs.pipeline.ingest.model.StageStatus;
import com.nursingjobs.pipeline.ingest.model.UpsertOutcome;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything one run accumulates: its state, counters, changed URLs and stage log files. Passed
 * explicitly through the stages; nothing here outlives the run.
 */
public class PipelineRunContext {
    private final String runId;
    private final String employerSlug;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Map<String, String> stageLogFiles = new LinkedHashMap<>();
    private final Set<String> changedUrls = new LinkedHashSet<>();
    private final List<String> announcedUrls = new ArrayList<>();

    private PipelineState state = PipelineState.SCRAPE_PENDING;
    private StageStatus scrapeStatus = StageStatus.NOT_RUN;
    private StageStatus classifyStatus = StageStatus.NOT_RUN;
    private StageStatus announceStatus = StageStatus.NOT_RUN;
    private int jobsFound;
    private int inserted;
    private int updated;
    private int unchanged;
    private int rejected;
    private int classificationsSucceeded;
    private int classificationsFailed;
    private int outOfScope;
    private BigDecimal estimatedCostUsd = BigDecimal.ZERO;
    private String errorMessage;

    public PipelineRunContext(String employerSlug, Instant startedAt) {
        this.runId = UUID.randomUUID().toString();
        this.employerSlug = employerSlug;
        this.startedAt = startedAt;
    }

    public synchronized PipelineState apply(PipelineEvent event) {
        state = PipelineStateMachine.next(state, event);
        switch (state) {
            case SCRAPE_SUCCEEDED -> scrapeStatus = StageStatus.SUCCEEDED;
            case SCRAPE_FAILED -> {
                scrapeStatus = StageStatus.FAILED;
                classifyStatus = StageStatus.SKIPPED;
                announceStatus = StageStatus.SKIPPED;
            }
            case CLASSIFY_SUCCEEDED -> classifyStatus = StageStatus.SUCCEEDED;
            case CLASSIFY_FAILED -> {
                classifyStatus = StageStatus.FAILED;
                announceStatus = StageStatus.SKIPPED;
            }
            default -> {
            }
        }
        return state;
    }

    public synchronized void recordListing(UpsertOutcome outcome) {
        jobsFound++;
        switch (outcome) {
            case INSERTED -> inserted++;
            case UPDATED -> updated++;
            case UNCHANGED -> unchanged++;
        }
    }

    public synchronized void recordRejected() {
        jobsFound++;
        rejected++;
    }

    public synchronized void recordClassification(ClassificationSummary summary) {
        classificationsSucceeded += summary.succeeded();
        classificationsFailed += summary.failed();
        outOfScope += summary.outOfScope();
        estimatedCostUsd = estimatedCostUsd.add(summary.estimatedCostUsd());
    }

    public synchronized void addChangedUrl(String url) {
        if (url != null) {
            changedUrls.add(url);
        }
    }

    public synchronized List<String> changedUrls() {
        return List.copyOf(changedUrls);
    }

    public synchronized void recordAnnouncement(StageStatus status, List<String> urls) {
        announceStatus = status;
        announcedUrls.addAll(urls);
    }

    public synchronized void putStageLogFile(String stage, String path) {
        stageLogFiles.put(stage, path);
    }

    public synchronized String stageLogFile(String stage) {
        return stageLogFiles.get(stage);
    }

    public synchronized void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String runId() {
        return runId;
    }

    public String employerSlug() {
        return employerSlug;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized PipelineState state() {
        return state;
    }

    public synchronized RunRecord toRunRecord(Instant finishedAt) {
        return new RunRecord(
            runId,
            employerSlug,
            startedAt,
            finishedAt,
            state,
            scrapeStatus,
            classifyStatus,
            announceStatus,
            jobsFound,
            inserted,
            updated,
            unchanged,
            rejected,
            classificationsSucceeded,
            classificationsFailed,
            outOfScope,
            estimatedCostUsd,
            List.copyOf(announcedUrls),
            errorMessage,
            Map.copyOf(stageLogFiles)
        );
    }
}
