package com.nursingjobs.pipeline.ingest.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Repository
public class IndexNowSubmissionRepository {
    private static final Logger log = LoggerFactory.getLogger(IndexNowSubmissionRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    public IndexNowSubmissionRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * The distinct subset of {@code urls} with no submission recorded at or after {@code since},
     * in input order.
     */
    public List<String> filterNotSubmittedSince(Collection<String> urls, Instant since) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        Set<String> submitted = new HashSet<>(jdbc.queryForList(
            "SELECT url FROM indexnow_submissions WHERE url IN (:urls) AND submitted_at >= :since",
            new MapSqlParameterSource()
                .addValue("urls", new ArrayList<>(urls))
                .addValue("since", Timestamp.from(since)),
            String.class
        ));
        List<String> out = new ArrayList<>();
        for (String url : urls) {
            if (!submitted.contains(url) && !out.contains(url)) {
                out.add(url);
            }
        }
        return out;
    }

    public void recordSubmitted(Collection<String> urls, String endpoint, Instant submittedAt) {
        for (String url : urls) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("url", url)
                .addValue("endpoint", endpoint)
                .addValue("submittedAt", Timestamp.from(submittedAt));
            int updated = jdbc.update(
                "UPDATE indexnow_submissions SET endpoint = :endpoint, submitted_at = :submittedAt WHERE url = :url",
                params
            );
            if (updated == 0) {
                try {
                    jdbc.update(
                        "INSERT INTO indexnow_submissions (url, endpoint, submitted_at) VALUES (:url, :endpoint, :submittedAt)",
                        params
                    );
                } catch (DuplicateKeyException e) {
                    log.debug("Submission of {} recorded concurrently", url);
                }
            }
        }
    }
}
