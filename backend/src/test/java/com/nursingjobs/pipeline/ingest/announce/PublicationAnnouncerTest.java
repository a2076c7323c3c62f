package com.nursingjobs.pipeline.ingest.announce;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.HttpFetchResult;
import com.nursingjobs.pipeline.ingest.persistence.IndexNowSubmissionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PublicationAnnouncerTest {
    private static final String INDEXNOW = "https://api.indexnow.org/IndexNow";
    private static final String BING = "https://www.bing.com/indexnow";

    private final List<List<String>> submittedBatches = new ArrayList<>();
    private final List<Long> sleeps = new ArrayList<>();
    private static final Instant RUN_START = Instant.parse("2026-03-10T11:55:00Z");

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC);
    private IndexNowSubmissionRepository submissions;
    private PipelineProperties properties;
    private int failingBatch = -1;

    @BeforeEach
    void setUp() {
        submissions = mock(IndexNowSubmissionRepository.class);
        when(submissions.filterNotSubmittedSince(any(), any())).thenAnswer(invocation -> {
            Collection<String> urls = invocation.getArgument(0);
            return new ArrayList<>(urls);
        });
        properties = new PipelineProperties();
        properties.setSiteUrl("https://nursing.test");
        properties.getAnnounce().setKey("abc123");
        properties.getAnnounce().setEndpoints(List.of(INDEXNOW));
        properties.getAnnounce().setBatchSize(2);
        properties.getAnnounce().setDelayBetweenBatchesMs(180_000L);
    }

    @Test
    void submitsInBatchesWithDelayBetweenThem() {
        List<String> urls = urls(5);

        AnnouncementSummary summary = announcer().announce(urls, RUN_START);

        assertThat(summary.skipped()).isFalse();
        assertThat(summary.batches()).isEqualTo(3);
        assertThat(submittedBatches).containsExactly(urls.subList(0, 2), urls.subList(2, 4), urls.subList(4, 5));
        assertThat(sleeps).containsExactly(180_000L, 180_000L);
        assertThat(summary.submittedUrls()).containsExactlyElementsOf(urls);
        assertThat(summary.failures()).isEmpty();
        verify(submissions).recordSubmitted(urls.subList(0, 2), INDEXNOW, clock.instant());
    }

    @Test
    void rejectedBatchIsReportedAndLaterBatchesStillRun() {
        failingBatch = 1;
        List<String> urls = urls(4);

        AnnouncementSummary summary = announcer().announce(urls, RUN_START);

        assertThat(submittedBatches).hasSize(2);
        assertThat(summary.submittedUrls()).containsExactlyElementsOf(urls.subList(2, 4));
        assertThat(summary.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.batchNumber()).isEqualTo(1);
            assertThat(failure.reason()).isEqualTo("http_429");
        });
        verify(submissions, never()).recordSubmitted(eq(urls.subList(0, 2)), anyString(), any());
    }

    @Test
    void alreadySubmittedUrlsAreNotResent() {
        doReturn(List.of()).when(submissions).filterNotSubmittedSince(any(), any());

        AnnouncementSummary summary = announcer().announce(urls(2), RUN_START);

        assertThat(summary.skipped()).isFalse();
        assertThat(summary.batches()).isZero();
        assertThat(submittedBatches).isEmpty();
        verify(submissions).filterNotSubmittedSince(urls(2), RUN_START);
    }

    @Test
    void disabledOrKeylessAnnouncementIsSkipped() {
        properties.getAnnounce().setKey(" ");

        AnnouncementSummary summary = announcer().announce(urls(3), RUN_START);

        assertThat(summary.skipped()).isTrue();
        assertThat(submittedBatches).isEmpty();
        verifyNoInteractions(submissions);
    }

    @Test
    void everyEndpointReceivesTheBatch() {
        properties.getAnnounce().setEndpoints(List.of(INDEXNOW, BING));

        AnnouncementSummary summary = announcer().announce(urls(1), RUN_START);

        assertThat(submittedBatches).hasSize(2);
        assertThat(summary.submittedUrls()).hasSize(1);
        verify(submissions).recordSubmitted(urls(1), BING, clock.instant());
    }

    private PublicationAnnouncer announcer() {
        SearchIndexSubmitter submitter = (endpoint, batch) -> {
            submittedBatches.add(List.copyOf(batch));
            int status = submittedBatches.size() == failingBatch ? 429 : 202;
            return new HttpFetchResult(endpoint, null, status, "", null, clock.instant(), Duration.ZERO, 1, null, null);
        };
        return new PublicationAnnouncer(submitter, submissions, properties, sleeps::add, clock);
    }

    private static List<String> urls(int count) {
        return IntStream.rangeClosed(1, count)
            .mapToObj(i -> "https://nursing.test/jobs/nursing/job-" + i)
            .collect(Collectors.toList());
    }
}
