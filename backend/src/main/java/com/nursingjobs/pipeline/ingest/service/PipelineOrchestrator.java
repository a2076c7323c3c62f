package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.config.PipelineProperties.SourceBinding;
import com.nursingjobs.pipeline.ingest.announce.AnnouncementSummary;
import com.nursingjobs.pipeline.ingest.announce.PublicationAnnouncer;
import com.nursingjobs.pipeline.ingest.classify.ClassificationGate;
import com.nursingjobs.pipeline.ingest.classify.ClassificationServiceException;
import com.nursingjobs.pipeline.ingest.model.ClassificationSummary;
import com.nursingjobs.pipeline.ingest.model.Employer;
import com.nursingjobs.pipeline.ingest.model.JobRecord;
import com.nursingjobs.pipeline.ingest.model.NormalizationResult;
import com.nursingjobs.pipeline.ingest.model.PipelineEvent;
import com.nursingjobs.pipeline.ingest.model.PipelineState;
import com.nursingjobs.pipeline.ingest.model.RawListing;
import com.nursingjobs.pipeline.ingest.model.RunRecord;
import com.nursingjobs.pipeline.ingest.model.StageStatus;
import com.nursingjobs.pipeline.ingest.model.UpsertOutcome;
import com.nursingjobs.pipeline.ingest.model.UpsertResult;
import com.nursingjobs.pipeline.ingest.normalize.ListingNormalizer;
import com.nursingjobs.pipeline.ingest.notify.AlertNotifier;
import com.nursingjobs.pipeline.ingest.persistence.ActivationStore;
import com.nursingjobs.pipeline.ingest.persistence.JdbcEmployerRepository;
import com.nursingjobs.pipeline.ingest.source.AdapterFetchException;
import com.nursingjobs.pipeline.ingest.source.FetchLimits;
import com.nursingjobs.pipeline.ingest.source.SourceAdapter;
import com.nursingjobs.pipeline.ingest.source.SourceAdapterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Runs one employer through scrape, classify and announce. A failed scrape never reaches the
 * classifier, and a failed classification never reaches the announcer; records persisted by
 * earlier stages are kept either way.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    private static final Logger summaryLog = LoggerFactory.getLogger("PIPELINE_SUMMARY");

    static final String STAGE_SCRAPER = "scraper";
    static final String STAGE_CLASSIFIER = "classifier";
    static final String STAGE_ANNOUNCER = "indexnow";

    private final SourceAdapterFactory adapterFactory;
    private final ListingNormalizer normalizer;
    private final ActivationStore store;
    private final JdbcEmployerRepository employers;
    private final ClassificationGate gate;
    private final PublicationAnnouncer announcer;
    private final AlertNotifier notifier;
    private final RunLogFiles logFiles;
    private final PipelineProperties properties;
    private final Clock clock;
    private final Map<String, PipelineRunContext> activeRuns = new ConcurrentHashMap<>();

    public PipelineOrchestrator(
        SourceAdapterFactory adapterFactory,
        ListingNormalizer normalizer,
        ActivationStore store,
        JdbcEmployerRepository employers,
        ClassificationGate gate,
        PublicationAnnouncer announcer,
        AlertNotifier notifier,
        RunLogFiles logFiles,
        PipelineProperties properties,
        Clock clock
    ) {
        this.adapterFactory = adapterFactory;
        this.normalizer = normalizer;
        this.store = store;
        this.employers = employers;
        this.gate = gate;
        this.announcer = announcer;
        this.notifier = notifier;
        this.logFiles = logFiles;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs the pipeline synchronously for one employer.
     *
     * @throws UnknownEmployerException when no source binding exists for the slug
     * @throws ActivePipelineRunException when a run for the same employer is still in flight
     */
    public RunRecord run(String employerSlug, Integer maxPages, Integer maxItems) {
        SourceBinding binding = adapterFactory.bindingFor(employerSlug);
        String slug = binding.getSlug();
        PipelineRunContext context = new PipelineRunContext(slug, clock.instant());
        PipelineRunContext existing = activeRuns.putIfAbsent(slug, context);
        if (existing != null) {
            throw new ActivePipelineRunException(
                "Pipeline run already in progress for " + slug
                    + " (id=" + existing.runId() + ", startedAt=" + existing.startedAt()
                    + ", state=" + existing.state() + ")"
            );
        }
        MDC.put("runId", context.runId());
        MDC.put("employer", slug);
        try {
            return execute(binding, context, new FetchLimits(maxPages, maxItems, context::isCancelled));
        } finally {
            MDC.remove("runId");
            MDC.remove("employer");
            activeRuns.remove(slug, context);
        }
    }

    /**
     * Requests cancellation of the in-flight run for the employer. Pages and classification
     * batches already started complete; nothing persisted is rolled back.
     *
     * @return whether a run was in flight
     */
    public boolean cancel(String employerSlug) {
        PipelineRunContext context = employerSlug == null ? null : activeRuns.get(employerSlug.trim().toLowerCase(Locale.ROOT));
        if (context == null) {
            return false;
        }
        log.info("Cancellation requested for pipeline run {} ({})", context.runId(), context.employerSlug());
        context.cancel();
        return true;
    }

    public boolean isRunning(String employerSlug) {
        return employerSlug != null && activeRuns.containsKey(employerSlug.trim().toLowerCase(Locale.ROOT));
    }

    private RunRecord execute(SourceBinding binding, PipelineRunContext context, FetchLimits limits) {
        log.info(
            "Pipeline run {} starting for {} (strategy={}, maxPages={}, maxItems={})",
            context.runId(),
            context.employerSlug(),
            binding.getStrategy(),
            limits.maxPages(),
            limits.maxItems()
        );
        Employer employer = scrape(binding, context, limits);
        if (employer != null && classify(employer, context)) {
            announce(context);
        }
        return finish(context);
    }

    private Employer scrape(SourceBinding binding, PipelineRunContext context, FetchLimits limits) {
        context.apply(PipelineEvent.START_SCRAPE);
        openStageLog(context, STAGE_SCRAPER);
        try {
            Employer employer = employers.getOrCreate(binding.getSlug(), binding.getName(), binding.getCareerPageUrl());
            SourceAdapter adapter = adapterFactory.create(binding);
            try (Stream<RawListing> listings = adapter.fetchListings(limits)) {
                listings.forEach(listing -> ingest(listing, employer, context));
            }
            if (context.isCancelled()) {
                fail(context, PipelineEvent.SCRAPE_ERROR, "cancelled during scrape");
                return null;
            }
            context.apply(PipelineEvent.SCRAPE_OK);
            RunRecord progress = context.toRunRecord(clock.instant());
            log.info(
                "Scrape finished for {}: found={}, inserted={}, updated={}, unchanged={}, rejected={}",
                employer.slug(),
                progress.jobsFound(),
                progress.inserted(),
                progress.updated(),
                progress.unchanged(),
                progress.rejected()
            );
            return employer;
        } catch (AdapterFetchException e) {
            log.error("Scrape failed for {} at {}: {}", e.getEmployerSlug(), e.getUrl(), e.getMessage(), e);
            fail(context, PipelineEvent.SCRAPE_ERROR, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.error("Scrape failed for {}: {}", context.employerSlug(), e.getMessage(), e);
            fail(context, PipelineEvent.SCRAPE_ERROR, describe(e));
            return null;
        } finally {
            closeStageLog();
        }
    }

    private void ingest(RawListing listing, Employer employer, PipelineRunContext context) {
        NormalizationResult result;
        try {
            result = normalizer.normalize(listing, employer);
        } catch (RuntimeException e) {
            log.warn("Normalization of {} failed: {}", listing.url(), e.getMessage(), e);
            result = NormalizationResult.rejected(listing, "unparseable listing: " + describe(e));
        }
        if (!result.isAccepted()) {
            context.recordRejected();
            log.warn(
                "Rejected listing {} ({}): {}",
                listing.externalId() == null ? "-" : listing.externalId(),
                listing.url(),
                result.rejection().reason()
            );
            return;
        }
        UpsertResult upsert = store.upsert(result.job());
        context.recordListing(upsert.outcome());
        if (upsert.outcome() == UpsertOutcome.UPDATED && upsert.record().isVisible()) {
            context.addChangedUrl(properties.jobUrl(upsert.record().slug()));
        }
        log.debug("Listing {} -> {} ({})", upsert.record().slug(), upsert.outcome(), upsert.record().lifecycleState());
    }

    private boolean classify(Employer employer, PipelineRunContext context) {
        context.apply(PipelineEvent.START_CLASSIFY);
        openStageLog(context, STAGE_CLASSIFIER);
        try {
            List<JobRecord> pending = store.listPending(employer.id());
            log.info("{} job(s) pending classification for {}", pending.size(), employer.slug());
            ClassificationSummary summary = gate.classify(pending, employer.name(), context::isCancelled);
            context.recordClassification(summary);
            for (JobRecord activated : summary.activated()) {
                context.addChangedUrl(properties.jobUrl(activated.slug()));
            }
            if (context.isCancelled()) {
                fail(context, PipelineEvent.CLASSIFY_ERROR, "cancelled during classification");
                return false;
            }
            if (summary.allAttemptsFailed() && properties.getClassification().isFailRunWhenAllFail()) {
                fail(context, PipelineEvent.CLASSIFY_ERROR, "all " + summary.attempted() + " classification attempt(s) failed");
                return false;
            }
            context.apply(PipelineEvent.CLASSIFY_OK);
            return true;
        } catch (ClassificationServiceException e) {
            log.error("Classification service unavailable for {}: {}", employer.slug(), e.getMessage());
            fail(context, PipelineEvent.CLASSIFY_ERROR, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Classification failed for {}: {}", employer.slug(), e.getMessage(), e);
            fail(context, PipelineEvent.CLASSIFY_ERROR, describe(e));
            return false;
        } finally {
            closeStageLog();
        }
    }

    private void announce(PipelineRunContext context) {
        context.apply(PipelineEvent.START_ANNOUNCE);
        List<String> changed = context.changedUrls();
        if (changed.isEmpty()) {
            log.info("No activated or updated jobs for {}; nothing to announce", context.employerSlug());
            context.recordAnnouncement(StageStatus.SKIPPED, List.of());
        } else {
            openStageLog(context, STAGE_ANNOUNCER);
            try {
                AnnouncementSummary summary = announcer.announce(changed, context.startedAt());
                StageStatus status = summary.skipped()
                    ? StageStatus.SKIPPED
                    : summary.failures().isEmpty() ? StageStatus.SUCCEEDED : StageStatus.FAILED;
                context.recordAnnouncement(status, summary.submittedUrls());
            } catch (RuntimeException e) {
                log.warn("Announcement failed for {}; jobs stay active: {}", context.employerSlug(), e.getMessage(), e);
                context.recordAnnouncement(StageStatus.FAILED, List.of());
            } finally {
                closeStageLog();
            }
        }
        context.apply(PipelineEvent.ANNOUNCE_FINISHED);
    }

    private RunRecord finish(PipelineRunContext context) {
        RunRecord record = context.toRunRecord(clock.instant());
        summaryLog.info(
            "run={} employer={} state={} scrape={} classify={} announce={} found={} inserted={} updated={} unchanged={} rejected={} classified={} classifyFailed={} outOfScope={} cost=${} announced={}{}",
            record.runId(),
            record.employerSlug(),
            record.finalState(),
            record.scrapeStatus(),
            record.classifyStatus(),
            record.announceStatus(),
            record.jobsFound(),
            record.inserted(),
            record.updated(),
            record.unchanged(),
            record.rejected(),
            record.classificationsSucceeded(),
            record.classificationsFailed(),
            record.outOfScope(),
            record.estimatedCostUsd(),
            record.announcedUrls().size(),
            record.errorMessage() == null ? "" : " error=\"" + record.errorMessage() + "\""
        );
        if (record.succeeded()) {
            notifier.sendAlert(subject(record, "completed"), summaryBody(record));
            logFiles.purgeOlderThan(properties.getLogs().getRetentionDays());
        } else {
            notifier.sendAlert(subject(record, "FAILED at " + record.finalState()), failureBody(record));
        }
        return record;
    }

    private void fail(PipelineRunContext context, PipelineEvent event, String message) {
        context.setErrorMessage(message);
        context.apply(event);
    }

    private void openStageLog(PipelineRunContext context, String stage) {
        Path file = logFiles.stageLogFile(context.employerSlug(), stage, context.startedAt());
        context.putStageLogFile(stage, file.toString());
        MDC.put(RunLogFiles.MDC_KEY, file.toString());
    }

    private void closeStageLog() {
        MDC.remove(RunLogFiles.MDC_KEY);
    }

    private String subject(RunRecord record, String outcome) {
        return properties.getNotify().getSubjectPrefix() + " " + record.employerSlug() + " pipeline " + outcome;
    }

    private String summaryBody(RunRecord record) {
        return String.join(
            "\n",
            "Employer: " + record.employerSlug(),
            "Run: " + record.runId(),
            "Started: " + record.startedAt(),
            "Finished: " + record.finishedAt(),
            "Jobs found: " + record.jobsFound()
                + " (inserted " + record.inserted()
                + ", updated " + record.updated()
                + ", unchanged " + record.unchanged()
                + ", rejected " + record.rejected() + ")",
            "Classified: " + record.classificationsSucceeded()
                + ", failed: " + record.classificationsFailed()
                + ", not staff RN: " + record.outOfScope(),
            "Estimated classification cost: $" + record.estimatedCostUsd(),
            "Announced URLs: " + record.announcedUrls().size() + " (" + record.announceStatus() + ")"
        );
    }

    private String failureBody(RunRecord record) {
        String stage = record.finalState() == PipelineState.SCRAPE_FAILED ? STAGE_SCRAPER : STAGE_CLASSIFIER;
        String logFile = record.stageLogFiles().get(stage);
        List<String> tail = logFile == null
            ? List.of()
            : logFiles.tail(Path.of(logFile), properties.getLogs().getTailLines());
        StringBuilder body = new StringBuilder();
        body.append("Employer: ").append(record.employerSlug()).append('\n');
        body.append("Exit state: ").append(record.finalState()).append('\n');
        body.append("Run: ").append(record.runId()).append('\n');
        body.append("Timestamp: ").append(record.finishedAt()).append('\n');
        body.append("Host: ").append(hostName()).append('\n');
        body.append("Error: ").append(record.errorMessage() == null ? "unknown" : record.errorMessage()).append('\n');
        body.append("Jobs found: ").append(record.jobsFound())
            .append(", classified: ").append(record.classificationsSucceeded())
            .append(", classification failures: ").append(record.classificationsFailed()).append('\n');
        if (logFile != null) {
            body.append("Log file: ").append(logFile).append('\n');
        }
        body.append("--- last ").append(tail.size()).append(" log line(s) ---\n");
        for (String line : tail) {
            body.append(line).append('\n');
        }
        return body.toString();
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = System.getenv("HOSTNAME");
            return fromEnv == null || fromEnv.isBlank() ? "unknown-host" : fromEnv;
        }
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
