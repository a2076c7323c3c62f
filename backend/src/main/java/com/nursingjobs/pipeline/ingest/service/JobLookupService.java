package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.DeletedJobTombstone;
import com.nursingjobs.pipeline.ingest.model.Employer;
import com.nursingjobs.pipeline.ingest.model.JobRecord;
import com.nursingjobs.pipeline.ingest.model.JobView;
import com.nursingjobs.pipeline.ingest.persistence.ActivationStore;
import com.nursingjobs.pipeline.ingest.persistence.JdbcEmployerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Public job lookup. Tombstones are consulted before the short-lived not-found cache, so a
 * retired slug answers "gone" even while an older "not found" is still cached.
 */
@Service
public class JobLookupService {
    private static final Logger log = LoggerFactory.getLogger(JobLookupService.class);

    private final ActivationStore store;
    private final JdbcEmployerRepository employers;
    private final PipelineProperties properties;
    private final Clock clock;
    private final Map<String, Instant> notFoundUntil = new ConcurrentHashMap<>();

    public JobLookupService(
        ActivationStore store,
        JdbcEmployerRepository employers,
        PipelineProperties properties,
        Clock clock
    ) {
        this.store = store;
        this.employers = employers;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws JobGoneException when the slug has a tombstone
     * @throws JobNotFoundException when no active job has the slug
     */
    public JobView lookup(String slug) {
        Optional<DeletedJobTombstone> tombstone = store.findTombstone(slug);
        if (tombstone.isPresent()) {
            notFoundUntil.remove(slug);
            throw new JobGoneException(tombstone.get());
        }

        Instant now = clock.instant();
        Instant cachedUntil = notFoundUntil.get(slug);
        if (cachedUntil != null) {
            if (cachedUntil.isAfter(now)) {
                throw new JobNotFoundException(slug);
            }
            notFoundUntil.remove(slug, cachedUntil);
        }

        Optional<JobRecord> job = store.findBySlug(slug).filter(JobRecord::isVisible);
        if (job.isEmpty()) {
            int ttl = properties.getLookup().getNotFoundCacheSeconds();
            if (ttl > 0) {
                rememberNotFound(slug, now, now.plus(Duration.ofSeconds(ttl)));
            }
            throw new JobNotFoundException(slug);
        }
        return toView(job.get());
    }

    int cachedNotFoundCount() {
        return notFoundUntil.size();
    }

    private void rememberNotFound(String slug, Instant now, Instant until) {
        int maxEntries = properties.getLookup().getNotFoundCacheMaxEntries();
        if (notFoundUntil.size() >= maxEntries) {
            notFoundUntil.values().removeIf(expiry -> !expiry.isAfter(now));
        }
        if (notFoundUntil.size() >= maxEntries && !notFoundUntil.containsKey(slug)) {
            log.debug("Not-found cache full ({} entries); not caching {}", maxEntries, slug);
            return;
        }
        notFoundUntil.put(slug, until);
    }

    public DeletedJobTombstone retire(String slug, String reason) {
        DeletedJobTombstone tombstone = store.retire(slug, reason == null || reason.isBlank() ? "removed" : reason.trim());
        notFoundUntil.remove(slug);
        log.info("Retired job {} ({})", slug, tombstone.reason());
        return tombstone;
    }

    private JobView toView(JobRecord job) {
        String employerName = employers.findById(job.employerId()).map(Employer::name).orElse(null);
        return new JobView(
            job.slug(),
            job.title(),
            employerName,
            job.city(),
            job.state(),
            job.specialty(),
            job.jobType(),
            job.shiftType(),
            job.experienceLevel(),
            job.salaryMin(),
            job.salaryMax(),
            job.salaryType(),
            job.postedDate(),
            job.sourceUrl()
        );
    }
}
