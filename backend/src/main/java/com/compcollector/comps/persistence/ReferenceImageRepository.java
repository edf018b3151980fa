package com.compcollector.comps.persistence;

import com.compcollector.comps.model.ReferenceImageRecord;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

@Repository
public class ReferenceImageRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public ReferenceImageRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Reference images still missing a quality score or crops. Never-attempted rows come first,
     * then the least recently attempted; rows that failed {@code maxAttempts} times are skipped.
     */
    public List<ReferenceImageRecord> findPending(int limit, int maxAttempts) {
        return jdbc.query(
            """
                SELECT id, raw_image_url, crop_urls, quality_score, created_at
                FROM reference_images
                WHERE raw_image_url IS NOT NULL
                  AND (quality_score IS NULL OR crop_urls IS NULL OR cardinality(crop_urls) = 0)
                  AND attempts < :maxAttempts
                ORDER BY last_attempted_at ASC NULLS FIRST, created_at ASC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("limit", Math.max(1, limit))
                .addValue("maxAttempts", Math.max(1, maxAttempts)),
            (rs, rowNum) -> new ReferenceImageRecord(
                rs.getString("id"),
                rs.getString("raw_image_url"),
                readCropUrls(rs),
                rs.getObject("quality_score", Double.class),
                toInstant(rs.getTimestamp("created_at"))
            )
        );
    }

    /**
     * Stores whatever was computed; {@code null} arguments keep the current column values.
     */
    public void updateProcessing(String id, Double qualityScore, List<String> cropUrls) {
        boolean hasCrops = cropUrls != null && !cropUrls.isEmpty();
        jdbc.update(
            """
                UPDATE reference_images
                SET quality_score = COALESCE(:qualityScore, quality_score),
                    crop_urls = CASE WHEN :hasCrops THEN string_to_array(:cropUrls, '|') ELSE crop_urls END,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("qualityScore", qualityScore, Types.DOUBLE)
                .addValue("hasCrops", hasCrops)
                .addValue("cropUrls", hasCrops ? String.join("|", cropUrls) : "")
                .addValue("now", Timestamp.from(Instant.now()))
        );
    }

    public void recordFailure(String id, String error) {
        Instant now = Instant.now();
        jdbc.update(
            """
                UPDATE reference_images
                SET attempts = attempts + 1,
                    last_attempted_at = :now,
                    last_error = :error,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("error", error)
                .addValue("now", Timestamp.from(now))
        );
    }

    private static List<String> readCropUrls(ResultSet rs) throws SQLException {
        Array array = rs.getArray("crop_urls");
        if (array == null) {
            return List.of();
        }
        try {
            Object raw = array.getArray();
            return raw instanceof String[] values ? Arrays.asList(values) : List.of();
        } finally {
            array.free();
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
