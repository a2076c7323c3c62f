package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.DeletedJobTombstone;
import com.nursingjobs.pipeline.ingest.model.Employer;
import com.nursingjobs.pipeline.ingest.model.JobRecordFixtures;
import com.nursingjobs.pipeline.ingest.model.JobView;
import com.nursingjobs.pipeline.ingest.model.LifecycleState;
import com.nursingjobs.pipeline.ingest.persistence.ActivationStore;
import com.nursingjobs.pipeline.ingest.persistence.JdbcEmployerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobLookupServiceTest {
    private ActivationStore store;
    private JdbcEmployerRepository employers;
    private MutableClock clock;
    private JobLookupService service;

    @BeforeEach
    void setUp() {
        store = mock(ActivationStore.class);
        employers = mock(JdbcEmployerRepository.class);
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        PipelineProperties properties = new PipelineProperties();
        properties.getLookup().setNotFoundCacheSeconds(60);
        properties.getLookup().setNotFoundCacheMaxEntries(3);
        when(store.findTombstone(anyString())).thenReturn(Optional.empty());
        service = new JobLookupService(store, employers, properties, clock);
    }

    @Test
    void returnsActiveJobWithEmployerName() {
        when(store.findBySlug("job-1")).thenReturn(Optional.of(JobRecordFixtures.active(1, "RN ICU", "ICU")));
        when(employers.findById(1L)).thenReturn(Optional.of(new Employer(1L, "lourdes", "Lourdes Hospital", null, null)));

        JobView view = service.lookup("job-1");

        assertThat(view.slug()).isEqualTo("job-1");
        assertThat(view.employerName()).isEqualTo("Lourdes Hospital");
        assertThat(view.specialty()).isEqualTo("ICU");
    }

    @Test
    void pendingJobsAreNotVisible() {
        when(store.findBySlug("job-2")).thenReturn(Optional.of(JobRecordFixtures.pending(2, "RN")));

        assertThatThrownBy(() -> service.lookup("job-2")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void tombstoneWinsOverCachedNotFound() {
        when(store.findBySlug("job-3")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> service.lookup("job-3")).isInstanceOf(JobNotFoundException.class);

        DeletedJobTombstone tombstone = new DeletedJobTombstone("job-3", "position filled", clock.instant());
        when(store.findTombstone("job-3")).thenReturn(Optional.of(tombstone));

        assertThatThrownBy(() -> service.lookup("job-3"))
            .isInstanceOf(JobGoneException.class)
            .satisfies(e -> assertThat(((JobGoneException) e).getTombstone().reason()).isEqualTo("position filled"));
    }

    @Test
    void notFoundIsCachedUntilItExpires() {
        when(store.findBySlug("job-4")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.lookup("job-4")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.lookup("job-4")).isInstanceOf(JobNotFoundException.class);
        verify(store, times(1)).findBySlug("job-4");

        clock.advance(Duration.ofSeconds(61));
        when(store.findBySlug("job-4")).thenReturn(Optional.of(JobRecordFixtures.record(4, "RN ER", LifecycleState.ACTIVE, "ER")));

        assertThat(service.lookup("job-4").specialty()).isEqualTo("ER");
    }

    @Test
    void notFoundCacheStaysBoundedUnderArbitrarySlugs() {
        when(store.findBySlug(anyString())).thenReturn(Optional.empty());
        for (int i = 0; i < 3; i++) {
            String slug = "missing-" + i;
            assertThatThrownBy(() -> service.lookup(slug)).isInstanceOf(JobNotFoundException.class);
        }
        assertThat(service.cachedNotFoundCount()).isEqualTo(3);

        assertThatThrownBy(() -> service.lookup("missing-3")).isInstanceOf(JobNotFoundException.class);
        assertThat(service.cachedNotFoundCount()).isEqualTo(3);

        clock.advance(Duration.ofSeconds(61));
        assertThatThrownBy(() -> service.lookup("missing-4")).isInstanceOf(JobNotFoundException.class);
        assertThat(service.cachedNotFoundCount()).isEqualTo(1);
    }

    @Test
    void retireDefaultsReason() {
        when(store.retire("job-5", "removed")).thenReturn(new DeletedJobTombstone("job-5", "removed", clock.instant()));

        assertThat(service.retire("job-5", " ").reason()).isEqualTo("removed");
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
