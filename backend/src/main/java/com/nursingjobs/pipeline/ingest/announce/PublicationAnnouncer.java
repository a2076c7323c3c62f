package com.nursingjobs.pipeline.ingest.announce;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.HttpFetchResult;
import com.nursingjobs.pipeline.ingest.persistence.IndexNowSubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort submission of changed job URLs to search-index endpoints. Failures are logged and
 * reported, never thrown.
 */
@Service
public class PublicationAnnouncer {
    private static final Logger log = LoggerFactory.getLogger(PublicationAnnouncer.class);

    private final SearchIndexSubmitter submitter;
    private final IndexNowSubmissionRepository submissions;
    private final PipelineProperties properties;
    private final Sleeper sleeper;
    private final Clock clock;

    public PublicationAnnouncer(
        SearchIndexSubmitter submitter,
        IndexNowSubmissionRepository submissions,
        PipelineProperties properties,
        Sleeper sleeper,
        Clock clock
    ) {
        this.submitter = submitter;
        this.submissions = submissions;
        this.properties = properties;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Submits {@code changedUrls} in batches. A URL already submitted at or after
     * {@code changedSince} is not sent again; older submissions predate the change and are
     * repeated.
     */
    public AnnouncementSummary announce(List<String> changedUrls, Instant changedSince) {
        PipelineProperties.Announce config = properties.getAnnounce();
        if (!config.isEnabled() || config.getKey() == null || config.getKey().isBlank() || config.getEndpoints().isEmpty()) {
            log.info("Announcement disabled or unconfigured; {} URL(s) not submitted", changedUrls.size());
            return AnnouncementSummary.notSubmitted();
        }
        List<String> pending = submissions.filterNotSubmittedSince(changedUrls, changedSince);
        if (pending.size() < changedUrls.size()) {
            log.info("Skipping {} URL(s) already submitted since {}", changedUrls.size() - pending.size(), changedSince);
        }
        if (pending.isEmpty()) {
            return new AnnouncementSummary(false, 0, List.of(), List.of());
        }

        int batchSize = config.getBatchSize();
        int totalBatches = (pending.size() + batchSize - 1) / batchSize;
        List<String> submitted = new ArrayList<>();
        List<AnnouncementFailure> failures = new ArrayList<>();
        for (int batch = 0; batch < totalBatches; batch++) {
            if (batch > 0 && !pause(config.getDelayBetweenBatchesMs())) {
                log.warn("Announcement interrupted before batch {}/{}", batch + 1, totalBatches);
                break;
            }
            List<String> urls = pending.subList(batch * batchSize, Math.min(pending.size(), (batch + 1) * batchSize));
            boolean accepted = false;
            for (String endpoint : config.getEndpoints()) {
                HttpFetchResult result = submitter.submit(endpoint, urls);
                if (submitter.isAccepted(result)) {
                    accepted = true;
                    log.info("Batch {}/{} ({} URLs) accepted by {}", batch + 1, totalBatches, urls.size(), endpoint);
                    submissions.recordSubmitted(urls, endpoint, clock.instant());
                } else {
                    String reason = result == null ? "no response" : result.describeFailure();
                    failures.add(new AnnouncementFailure(endpoint, batch + 1, urls.size(), reason));
                    log.warn("Batch {}/{} ({} URLs) rejected by {}: {}", batch + 1, totalBatches, urls.size(), endpoint, reason);
                }
            }
            if (accepted) {
                submitted.addAll(urls);
            }
        }
        return new AnnouncementSummary(false, totalBatches, submitted, failures);
    }

    private boolean pause(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
