package com.compcollector.comps.persistence;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Card assets the comps are collected for.
 */
@Repository
public class SubjectRepository {
    public static final String READY_FOR_HUMAN_REVIEW = "READY_FOR_HUMAN_REVIEW";

    private final NamedParameterJdbcTemplate jdbc;

    public SubjectRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public int updateReviewStage(String subjectId, String reviewStage) {
        Instant now = Instant.now();
        return jdbc.update(
            """
                UPDATE card_assets
                SET review_stage = :reviewStage,
                    review_stage_updated_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", subjectId)
                .addValue("reviewStage", reviewStage)
                .addValue("now", Timestamp.from(now))
        );
    }

    public Optional<String> findImageUrl(String subjectId) {
        List<String> rows = jdbc.query(
            """
                SELECT image_url
                FROM card_assets
                WHERE id = :id
                  AND image_url IS NOT NULL
                """,
            new MapSqlParameterSource().addValue("id", subjectId),
            (rs, rowNum) -> rs.getString("image_url")
        );
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }
}
