package com.compcollector.comps.persistence;

import com.compcollector.comps.model.CompJob;
import com.compcollector.comps.model.CompJobView;
import com.compcollector.comps.model.CompQueueErrorSample;
import com.compcollector.comps.model.CompQueueStats;
import com.compcollector.comps.model.EnqueueJobRequest;
import com.compcollector.comps.model.JobStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class CompJobRepository {
    private static final Logger log = LoggerFactory.getLogger(CompJobRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CompJobRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public String enqueue(EnqueueJobRequest request) {
        if (request.searchQuery() == null || request.searchQuery().isBlank()) {
            throw new IllegalArgumentException("searchQuery is required");
        }
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("subjectId", blankToNull(request.subjectId()))
            .addValue("searchQuery", request.searchQuery().trim())
            .addValue("sources", String.join(",", request.normalizedSources()))
            .addValue("maxComps", request.effectiveMaxComps())
            .addValue("maxAgeDays", request.effectiveMaxAgeDays())
            .addValue("payload", request.payload() == null ? null : request.payload().toString())
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                INSERT INTO comp_jobs (
                    id, status, subject_id, search_query, sources, max_comps, max_age_days,
                    payload, attempts, created_at, updated_at
                )
                VALUES (
                    :id, 'QUEUED', :subjectId, :searchQuery, string_to_array(:sources, ','), :maxComps, :maxAgeDays,
                    CAST(:payload AS JSONB), 0, :now, :now
                )
                """,
            params
        );
        return id;
    }

    /**
     * Atomically moves the oldest QUEUED job to RUNNING for {@code lockOwner}. Concurrent callers
     * never receive the same job.
     */
    public Optional<CompJob> claimNextQueuedJob(String lockOwner) {
        Instant now = Instant.now();
        String safeOwner = (lockOwner == null || lockOwner.isBlank()) ? "unknown" : lockOwner.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("lockOwner", safeOwner);

        List<CompJob> results = jdbc.query(
            """
                WITH candidate AS (
                    SELECT id
                    FROM comp_jobs
                    WHERE status = 'QUEUED'
                    ORDER BY created_at ASC
                    FOR UPDATE SKIP LOCKED
                    LIMIT 1
                )
                UPDATE comp_jobs cj
                SET status = 'RUNNING',
                    attempts = cj.attempts + 1,
                    locked_at = :now,
                    lock_owner = :lockOwner,
                    error_message = NULL,
                    updated_at = :now
                FROM candidate
                WHERE cj.id = candidate.id
                  AND cj.status = 'QUEUED'
                RETURNING cj.id, cj.status, cj.subject_id, cj.search_query, cj.sources, cj.max_comps,
                          cj.max_age_days, cj.payload, cj.attempts, cj.created_at, cj.completed_at
                """,
            params,
            (rs, rowNum) -> mapJob(rs)
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Records a status transition. A job that is already COMPLETE or FAILED is left untouched.
     *
     * @return {@code true} when a row changed
     */
    public boolean markJobStatus(String jobId, JobStatus status, String errorMessage, String resultJson) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", jobId)
            .addValue("status", status.name())
            .addValue("error", errorMessage)
            .addValue("result", resultJson)
            .addValue("completedAt", status.isTerminal() ? Timestamp.from(now) : null)
            .addValue("now", Timestamp.from(now));
        int updated = jdbc.update(
            """
                UPDATE comp_jobs
                SET status = :status,
                    error_message = :error,
                    result = COALESCE(CAST(:result AS JSONB), result),
                    completed_at = :completedAt,
                    locked_at = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status NOT IN ('COMPLETE', 'FAILED')
                """,
            params
        );
        if (updated == 0) {
            log.warn("Comp job {} was not moved to {} (missing or already terminal)", jobId, status);
        }
        return updated > 0;
    }

    public Optional<CompJobView> findById(String jobId) {
        List<CompJobView> rows = jdbc.query(
            """
                SELECT id, status, subject_id, search_query, sources, max_comps, max_age_days,
                       payload, result, error_message, attempts, lock_owner, locked_at,
                       created_at, updated_at, completed_at
                FROM comp_jobs
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", jobId),
            (rs, rowNum) -> new CompJobView(
                rs.getString("id"),
                JobStatus.valueOf(rs.getString("status")),
                rs.getString("subject_id"),
                rs.getString("search_query"),
                readSources(rs),
                rs.getInt("max_comps"),
                rs.getInt("max_age_days"),
                readJson(rs.getString("payload")),
                readJson(rs.getString("result")),
                rs.getString("error_message"),
                rs.getInt("attempts"),
                rs.getString("lock_owner"),
                toInstant(rs.getTimestamp("locked_at")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                toInstant(rs.getTimestamp("completed_at"))
            )
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Puts a terminal job back in the queue, clearing its result and error.
     *
     * @return {@code false} when the job is not terminal
     */
    public boolean reset(String jobId) {
        Instant now = Instant.now();
        int updated = jdbc.update(
            """
                UPDATE comp_jobs
                SET status = 'QUEUED',
                    result = NULL,
                    error_message = NULL,
                    completed_at = NULL,
                    locked_at = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE id = :id
                  AND status IN ('COMPLETE', 'FAILED')
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("now", Timestamp.from(now))
        );
        return updated > 0;
    }

    /**
     * Extends the lease of a job this worker still holds so the stale sweep leaves it alone.
     */
    public boolean refreshLock(String jobId, String lockOwner) {
        Instant now = Instant.now();
        int updated = jdbc.update(
            """
                UPDATE comp_jobs
                SET locked_at = :now,
                    updated_at = :now
                WHERE id = :id
                  AND status = 'RUNNING'
                  AND lock_owner = :owner
                """,
            new MapSqlParameterSource()
                .addValue("id", jobId)
                .addValue("owner", lockOwner)
                .addValue("now", Timestamp.from(now))
        );
        return updated > 0;
    }

    public int failStaleRunningJobs(Instant lockedBefore, String errorMessage) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE comp_jobs
                SET status = 'FAILED',
                    error_message = :error,
                    completed_at = :now,
                    locked_at = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE status = 'RUNNING'
                  AND locked_at < :cutoff
                """,
            new MapSqlParameterSource()
                .addValue("error", errorMessage)
                .addValue("cutoff", Timestamp.from(lockedBefore))
                .addValue("now", Timestamp.from(now))
        );
    }

    public CompQueueStats fetchQueueStats(int errorSampleLimit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, errorSampleLimit));

        Long queuedCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM comp_jobs
                WHERE status = 'QUEUED'
                """,
            params,
            Long.class
        );
        Long runningCount = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM comp_jobs
                WHERE status = 'RUNNING'
                """,
            params,
            Long.class
        );
        Timestamp oldestQueued = jdbc.queryForObject(
            """
                SELECT MIN(created_at)
                FROM comp_jobs
                WHERE status = 'QUEUED'
                """,
            params,
            Timestamp.class
        );
        List<CompQueueErrorSample> errors = jdbc.query(
            """
                SELECT id, error_message, completed_at, attempts
                FROM comp_jobs
                WHERE status = 'FAILED'
                  AND error_message IS NOT NULL
                ORDER BY completed_at DESC NULLS LAST
                LIMIT :limit
                """,
            params,
            (rs, rowNum) -> new CompQueueErrorSample(
                rs.getString("id"),
                rs.getString("error_message"),
                toInstant(rs.getTimestamp("completed_at")),
                rs.getInt("attempts")
            )
        );
        return new CompQueueStats(
            queuedCount == null ? 0 : queuedCount,
            runningCount == null ? 0 : runningCount,
            toInstant(oldestQueued),
            errors
        );
    }

    private CompJob mapJob(ResultSet rs) throws SQLException {
        return new CompJob(
            rs.getString("id"),
            JobStatus.valueOf(rs.getString("status")),
            rs.getString("subject_id"),
            rs.getString("search_query"),
            readSources(rs),
            rs.getInt("max_comps"),
            rs.getInt("max_age_days"),
            readJson(rs.getString("payload")),
            rs.getInt("attempts"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private List<String> readSources(ResultSet rs) throws SQLException {
        Array array = rs.getArray("sources");
        if (array == null) {
            return List.of();
        }
        try {
            Object raw = array.getArray();
            if (raw instanceof String[] values) {
                return Arrays.asList(values);
            }
            return List.of();
        } finally {
            array.free();
        }
    }

    private JsonNode readJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(value);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparseable JSON column value: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
