package com.compcollector.comps.persistence;

import com.compcollector.comps.model.EvidenceItem;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Repository
public class EvidenceRepository {
    public static final String KIND_SOLD_COMP = "SOLD_COMP";

    private final NamedParameterJdbcTemplate jdbc;

    public EvidenceRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Set<String> findAttachedUrls(String subjectId) {
        return new HashSet<>(jdbc.query(
            """
                SELECT url
                FROM evidence_items
                WHERE card_asset_id = :subjectId
                  AND kind = :kind
                """,
            new MapSqlParameterSource()
                .addValue("subjectId", subjectId)
                .addValue("kind", KIND_SOLD_COMP),
            (rs, rowNum) -> rs.getString("url")
        ));
    }

    /**
     * @return {@code true} when a row was inserted; an existing row for the same URL wins
     */
    public boolean insertEvidence(EvidenceItem item) {
        int inserted = jdbc.update(
            """
                INSERT INTO evidence_items (
                    id, card_asset_id, kind, source, title, url, screenshot_url, price, sold_date, note, created_at
                )
                VALUES (
                    :id, :subjectId, :kind, :source, :title, :url, :screenshotUrl, :price, :soldDate, :note, :now
                )
                ON CONFLICT (card_asset_id, kind, url) DO NOTHING
                """,
            new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID().toString())
                .addValue("subjectId", item.subjectId())
                .addValue("kind", KIND_SOLD_COMP)
                .addValue("source", item.source())
                .addValue("title", item.title())
                .addValue("url", item.url())
                .addValue("screenshotUrl", item.screenshotUrl())
                .addValue("price", item.price())
                .addValue("soldDate", item.soldDate())
                .addValue("note", item.note())
                .addValue("now", Timestamp.from(Instant.now()))
        );
        return inserted > 0;
    }
}
