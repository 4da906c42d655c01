package com.interngenie.gateway.insights.persistence;

import com.interngenie.gateway.insights.model.ApplicationStats;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class InsightsJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public InsightsJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<String> findBehaviorDocuments(long userId) {
        return jdbc.queryForList(
            """
                SELECT behavior_data
                FROM user_behaviors
                WHERE user_id = :userId
                ORDER BY id
                """,
            new MapSqlParameterSource("userId", userId),
            String.class
        );
    }

    public ApplicationStats applicationStats() {
        return jdbc.queryForObject(
            """
                SELECT COUNT(*) AS total,
                       COALESCE(SUM(CASE WHEN status = 'accepted' THEN 1 ELSE 0 END), 0) AS accepted
                FROM applications
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new ApplicationStats(rs.getLong("total"), rs.getLong("accepted"))
        );
    }
}
