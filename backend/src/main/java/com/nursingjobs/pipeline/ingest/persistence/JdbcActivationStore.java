package com.nursingjobs.pipeline.ingest.persistence;

import com.nursingjobs.pipeline.ingest.model.Classification;
import com.nursingjobs.pipeline.ingest.model.DeletedJobTombstone;
import com.nursingjobs.pipeline.ingest.model.JobRecord;
import com.nursingjobs.pipeline.ingest.model.LifecycleState;
import com.nursingjobs.pipeline.ingest.model.NormalizedJob;
import com.nursingjobs.pipeline.ingest.model.SalaryType;
import com.nursingjobs.pipeline.ingest.model.UpsertOutcome;
import com.nursingjobs.pipeline.ingest.model.UpsertResult;
import com.nursingjobs.pipeline.ingest.normalize.SpecialtyVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcActivationStore implements ActivationStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcActivationStore.class);

    private static final String JOB_COLUMNS = """
        id, identity_key, employer_id, title, slug, city, state, specialty, job_type, shift_type,
        experience_level, salary_min, salary_max, salary_type, posted_date, source_url, description,
        content_hash, lifecycle_state, classified_at, created_at, updated_at
        """;

    private static final RowMapper<JobRecord> JOB_MAPPER = JdbcActivationStore::mapJob;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JdbcActivationStore(
        NamedParameterJdbcTemplate jdbc,
        PlatformTransactionManager transactionManager,
        Clock clock
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public Optional<JobRecord> findByIdentityKey(long employerId, String identityKey) {
        return first(jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM job_records WHERE employer_id = :employerId AND identity_key = :identityKey",
            new MapSqlParameterSource()
                .addValue("employerId", employerId)
                .addValue("identityKey", identityKey),
            JOB_MAPPER
        ));
    }

    @Override
    public UpsertResult upsert(NormalizedJob job) {
        try {
            return transactionTemplate.execute(status -> upsertLocked(job));
        } catch (DuplicateKeyException e) {
            // Two writers inserted the same identity key; apply this write on top of the winner's row.
            log.warn(
                "Identity conflict for employer {} key {}; later write wins: {}",
                job.employerSlug(),
                job.identityKey(),
                e.getMostSpecificCause().getMessage()
            );
            return transactionTemplate.execute(status -> upsertLocked(job));
        }
    }

    private UpsertResult upsertLocked(NormalizedJob job) {
        Optional<JobRecord> existing = first(jdbc.query(
            "SELECT " + JOB_COLUMNS
                + " FROM job_records WHERE employer_id = :employerId AND identity_key = :identityKey FOR UPDATE",
            new MapSqlParameterSource()
                .addValue("employerId", job.employerId())
                .addValue("identityKey", job.identityKey()),
            JOB_MAPPER
        ));
        Instant now = clock.instant();
        if (existing.isEmpty()) {
            MapSqlParameterSource params = fieldParams(job, now)
                .addValue("slug", availableSlug(job))
                .addValue("state", LifecycleState.PENDING_CLASSIFICATION.name())
                .addValue("createdAt", Timestamp.from(now));
            jdbc.update(
                """
                    INSERT INTO job_records (
                        employer_id, identity_key, slug, title, city, state, specialty_hint, job_type,
                        salary_min, salary_max, salary_type, posted_date, source_url, department, description,
                        content_hash, lifecycle_state, created_at, updated_at
                    ) VALUES (
                        :employerId, :identityKey, :slug, :title, :city, :stateCode, :specialtyHint, :jobType,
                        :salaryMin, :salaryMax, :salaryType, :postedDate, :sourceUrl, :department, :description,
                        :contentHash, :state, :createdAt, :updatedAt
                    )
                    """,
                params
            );
            JobRecord inserted = findByIdentityKey(job.employerId(), job.identityKey())
                .orElseThrow(() -> new IllegalStateException("Inserted job " + job.identityKey() + " not readable"));
            return new UpsertResult(UpsertOutcome.INSERTED, inserted);
        }

        JobRecord current = existing.get();
        if (job.contentHash().equals(current.contentHash())) {
            return new UpsertResult(UpsertOutcome.UNCHANGED, current);
        }
        MapSqlParameterSource params = fieldParams(job, now).addValue("id", current.id());
        jdbc.update(
            """
                UPDATE job_records
                SET title = :title,
                    city = :city,
                    state = :stateCode,
                    specialty_hint = :specialtyHint,
                    job_type = COALESCE(:jobType, job_type),
                    salary_min = :salaryMin,
                    salary_max = :salaryMax,
                    salary_type = :salaryType,
                    posted_date = :postedDate,
                    source_url = :sourceUrl,
                    department = :department,
                    description = :description,
                    content_hash = :contentHash,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params
        );
        JobRecord updated = findById(current.id())
            .orElseThrow(() -> new IllegalStateException("Updated job " + current.id() + " not readable"));
        return new UpsertResult(UpsertOutcome.UPDATED, updated);
    }

    @Override
    public List<JobRecord> markActive(Collection<Long> ids, Classification classification) {
        if (classification == null || !SpecialtyVocabulary.contains(classification.specialty())) {
            throw new IllegalArgumentException("A job cannot become active without a known specialty");
        }
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        return transactionTemplate.execute(status -> {
            List<Long> promotable = jdbc.queryForList(
                """
                    SELECT id FROM job_records
                    WHERE id IN (:ids) AND lifecycle_state = 'PENDING_CLASSIFICATION'
                    FOR UPDATE
                    """,
                new MapSqlParameterSource("ids", new ArrayList<>(ids)),
                Long.class
            );
            if (promotable.isEmpty()) {
                return List.of();
            }
            jdbc.update(
                """
                    UPDATE job_records
                    SET lifecycle_state = 'ACTIVE',
                        specialty = :specialty,
                        job_type = COALESCE(:jobType, job_type),
                        shift_type = :shiftType,
                        experience_level = :experienceLevel,
                        classification_confidence = :confidence,
                        classified_at = :now,
                        updated_at = :now
                    WHERE id IN (:ids)
                    """,
                new MapSqlParameterSource()
                    .addValue("ids", promotable)
                    .addValue("specialty", SpecialtyVocabulary.canonical(classification.specialty()))
                    .addValue("jobType", classification.jobType())
                    .addValue("shiftType", classification.shiftType())
                    .addValue("experienceLevel", classification.experienceLevel())
                    .addValue("confidence", classification.confidence())
                    .addValue("now", Timestamp.from(now))
            );
            return jdbc.query(
                "SELECT " + JOB_COLUMNS + " FROM job_records WHERE id IN (:ids) ORDER BY id",
                new MapSqlParameterSource("ids", promotable),
                JOB_MAPPER
            );
        });
    }

    @Override
    public int markInactive(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return jdbc.update(
            """
                UPDATE job_records
                SET lifecycle_state = 'INACTIVE', updated_at = :now
                WHERE id IN (:ids) AND lifecycle_state <> 'DELETED'
                """,
            new MapSqlParameterSource()
                .addValue("ids", new ArrayList<>(ids))
                .addValue("now", Timestamp.from(clock.instant()))
        );
    }

    @Override
    public List<JobRecord> listPending(long employerId) {
        return jdbc.query(
            "SELECT " + JOB_COLUMNS
                + " FROM job_records WHERE employer_id = :employerId AND lifecycle_state = 'PENDING_CLASSIFICATION' ORDER BY id",
            new MapSqlParameterSource("employerId", employerId),
            JOB_MAPPER
        );
    }

    @Override
    public DeletedJobTombstone createTombstone(String slug, String reason) {
        Optional<DeletedJobTombstone> existing = findTombstone(slug);
        if (existing.isPresent()) {
            return existing.get();
        }
        Instant now = clock.instant();
        jdbc.update(
            "INSERT INTO deleted_job_tombstones (slug, reason, created_at) VALUES (:slug, :reason, :createdAt)",
            new MapSqlParameterSource()
                .addValue("slug", slug)
                .addValue("reason", reason)
                .addValue("createdAt", Timestamp.from(now))
        );
        return new DeletedJobTombstone(slug, reason, now);
    }

    @Override
    public Optional<DeletedJobTombstone> findTombstone(String slug) {
        return first(jdbc.query(
            "SELECT slug, reason, created_at FROM deleted_job_tombstones WHERE slug = :slug",
            new MapSqlParameterSource("slug", slug),
            (rs, rowNum) -> new DeletedJobTombstone(
                rs.getString("slug"),
                rs.getString("reason"),
                toInstant(rs.getTimestamp("created_at"))
            )
        ));
    }

    @Override
    public Optional<JobRecord> findBySlug(String slug) {
        return first(jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM job_records WHERE slug = :slug",
            new MapSqlParameterSource("slug", slug),
            JOB_MAPPER
        ));
    }

    @Override
    public DeletedJobTombstone retire(String slug, String reason) {
        return transactionTemplate.execute(status -> {
            jdbc.update(
                "UPDATE job_records SET lifecycle_state = 'DELETED', updated_at = :now WHERE slug = :slug",
                new MapSqlParameterSource()
                    .addValue("slug", slug)
                    .addValue("now", Timestamp.from(clock.instant()))
            );
            return createTombstone(slug, reason);
        });
    }

    public Optional<JobRecord> findById(long id) {
        return first(jdbc.query(
            "SELECT " + JOB_COLUMNS + " FROM job_records WHERE id = :id",
            new MapSqlParameterSource("id", id),
            JOB_MAPPER
        ));
    }

    private String availableSlug(NormalizedJob job) {
        Integer taken = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_records WHERE slug = :slug",
            new MapSqlParameterSource("slug", job.slug()),
            Integer.class
        );
        if (taken == null || taken == 0) {
            return job.slug();
        }
        String suffix = "-" + job.identityKey().substring(0, 8);
        String base = job.slug().length() + suffix.length() > 128
            ? job.slug().substring(0, 128 - suffix.length())
            : job.slug();
        log.info("Slug {} already taken; using {}{}", job.slug(), base, suffix);
        return base + suffix;
    }

    private MapSqlParameterSource fieldParams(NormalizedJob job, Instant now) {
        return new MapSqlParameterSource()
            .addValue("employerId", job.employerId())
            .addValue("identityKey", job.identityKey())
            .addValue("title", job.title())
            .addValue("city", job.city())
            .addValue("stateCode", job.state())
            .addValue("specialtyHint", job.specialtyHint())
            .addValue("jobType", job.jobType())
            .addValue("salaryMin", job.salaryMin())
            .addValue("salaryMax", job.salaryMax())
            .addValue("salaryType", job.salaryType() == null ? null : job.salaryType().name())
            .addValue("postedDate", job.postedDate() == null ? null : Date.valueOf(job.postedDate()))
            .addValue("sourceUrl", job.sourceUrl())
            .addValue("department", job.department())
            .addValue("description", job.description())
            .addValue("contentHash", job.contentHash())
            .addValue("updatedAt", Timestamp.from(now));
    }

    private static JobRecord mapJob(ResultSet rs, int rowNum) throws SQLException {
        String salaryType = rs.getString("salary_type");
        Date postedDate = rs.getDate("posted_date");
        return new JobRecord(
            rs.getLong("id"),
            rs.getString("identity_key"),
            rs.getLong("employer_id"),
            rs.getString("title"),
            rs.getString("slug"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("specialty"),
            rs.getString("job_type"),
            rs.getString("shift_type"),
            rs.getString("experience_level"),
            rs.getBigDecimal("salary_min"),
            rs.getBigDecimal("salary_max"),
            salaryType == null ? null : SalaryType.valueOf(salaryType),
            postedDate == null ? null : postedDate.toLocalDate(),
            rs.getString("source_url"),
            rs.getString("description"),
            rs.getString("content_hash"),
            LifecycleState.valueOf(rs.getString("lifecycle_state")),
            toInstant(rs.getTimestamp("classified_at")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
