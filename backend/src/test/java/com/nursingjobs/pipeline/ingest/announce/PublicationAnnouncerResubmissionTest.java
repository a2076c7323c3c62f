package com.nursingjobs.pipeline.ingest.announce;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.HttpFetchResult;
import com.nursingjobs.pipeline.ingest.persistence.IndexNowSubmissionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PublicationAnnouncerResubmissionTest {
    private static final Instant FIRST_RUN = Instant.parse("2026-03-10T06:00:00Z");
    private static final Instant SECOND_RUN = Instant.parse("2026-03-11T06:00:00Z");

    @Autowired
    private IndexNowSubmissionRepository submissions;

    private final List<List<String>> sentBatches = new ArrayList<>();
    private PipelineProperties properties;
    private String url;

    @BeforeEach
    void setUp() {
        url = "https://nursing.test/jobs/nursing/rn-icu-" + UUID.randomUUID().toString().substring(0, 8);
        properties = new PipelineProperties();
        properties.setSiteUrl("https://nursing.test");
        properties.getAnnounce().setKey("abc123");
        properties.getAnnounce().setEndpoints(List.of("https://api.indexnow.org/IndexNow"));
        properties.getAnnounce().setDelayBetweenBatchesMs(0L);
    }

    @Test
    void jobUpdatedInALaterRunIsSubmittedAgain() {
        AnnouncementSummary activation = announcerAt(FIRST_RUN.plusSeconds(60)).announce(List.of(url), FIRST_RUN);
        AnnouncementSummary update = announcerAt(SECOND_RUN.plusSeconds(60)).announce(List.of(url), SECOND_RUN);

        assertThat(activation.submittedUrls()).containsExactly(url);
        assertThat(update.submittedUrls()).containsExactly(url);
        assertThat(sentBatches).containsExactly(List.of(url), List.of(url));
    }

    @Test
    void urlAlreadySubmittedSinceTheChangeIsNotRepeated() {
        announcerAt(FIRST_RUN.plusSeconds(60)).announce(List.of(url), FIRST_RUN);

        AnnouncementSummary repeat = announcerAt(FIRST_RUN.plusSeconds(120)).announce(List.of(url, url), FIRST_RUN);

        assertThat(repeat.submittedUrls()).isEmpty();
        assertThat(repeat.batches()).isZero();
        assertThat(sentBatches).containsExactly(List.of(url));
    }

    private PublicationAnnouncer announcerAt(Instant now) {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        SearchIndexSubmitter submitter = (endpoint, batch) -> {
            sentBatches.add(List.copyOf(batch));
            return new HttpFetchResult(endpoint, null, 200, "", null, now, Duration.ZERO, 1, null, null);
        };
        return new PublicationAnnouncer(submitter, submissions, properties, delayMs -> { }, clock);
    }
}
