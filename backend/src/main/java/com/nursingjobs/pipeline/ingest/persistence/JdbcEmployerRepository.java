package com.nursingjobs.pipeline.ingest.persistence;

import com.nursingjobs.pipeline.ingest.model.Employer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcEmployerRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcEmployerRepository.class);
    private static final RowMapper<Employer> EMPLOYER_MAPPER = (rs, rowNum) -> new Employer(
        rs.getLong("id"),
        rs.getString("slug"),
        rs.getString("name"),
        rs.getString("career_page_url"),
        rs.getTimestamp("created_at") == null ? null : rs.getTimestamp("created_at").toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcEmployerRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public Optional<Employer> findBySlug(String slug) {
        List<Employer> rows = jdbc.query(
            """
                SELECT id, slug, name, career_page_url, created_at
                FROM employers
                WHERE slug = :slug
                """,
            new MapSqlParameterSource("slug", slug),
            EMPLOYER_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Employer> findById(long id) {
        List<Employer> rows = jdbc.query(
            """
                SELECT id, slug, name, career_page_url, created_at
                FROM employers
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            EMPLOYER_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Returns the employer for {@code slug}, creating it on first sight. Only display metadata
     * is refreshed for an existing employer.
     */
    public Employer getOrCreate(String slug, String name, String careerPageUrl) {
        Timestamp now = Timestamp.from(clock.instant());
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("slug", slug)
            .addValue("name", name == null || name.isBlank() ? slug : name)
            .addValue("careerPageUrl", careerPageUrl)
            .addValue("now", now);
        int updated = jdbc.update(
            """
                UPDATE employers
                SET name = :name,
                    career_page_url = :careerPageUrl,
                    updated_at = :now
                WHERE slug = :slug
                """,
            params
        );
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO employers (slug, name, career_page_url, created_at, updated_at)
                        VALUES (:slug, :name, :careerPageUrl, :now, :now)
                        """,
                    params
                );
            } catch (DuplicateKeyException e) {
                log.debug("Employer {} created concurrently; refreshing metadata", slug);
                jdbc.update(
                    "UPDATE employers SET name = :name, career_page_url = :careerPageUrl, updated_at = :now WHERE slug = :slug",
                    params
                );
            }
        }
        return findBySlug(slug)
            .orElseThrow(() -> new IllegalStateException("Employer " + slug + " missing after upsert"));
    }
}
