package com.compcollector.comps.persistence;

import com.compcollector.comps.model.PlaybookRule;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class PlaybookRuleRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public PlaybookRuleRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<PlaybookRule> findEnabledRules(String source) {
        return jdbc.query(
            """
                SELECT id, source, action, selector, url_contains, label, priority, enabled
                FROM playbook_rules
                WHERE source = :source
                  AND enabled = TRUE
                ORDER BY priority DESC, created_at ASC
                """,
            new MapSqlParameterSource().addValue("source", source),
            (rs, rowNum) -> new PlaybookRule(
                rs.getString("id"),
                rs.getString("source"),
                rs.getString("action"),
                rs.getString("selector"),
                rs.getString("url_contains"),
                rs.getString("label"),
                rs.getInt("priority"),
                rs.getBoolean("enabled")
            )
        );
    }
}
