package com.interngenie.gateway.recommend.persistence;

import com.interngenie.gateway.recommend.model.CandidateProfile;
import com.interngenie.gateway.recommend.model.InternshipPosting;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class RecommendationJdbcRepository implements ProfilePostingStore {
    private static final RowMapper<CandidateProfile> PROFILE_MAPPER = (rs, rowNum) -> new CandidateProfile(
        rs.getLong("id"),
        rs.getString("email"),
        rs.getString("name"),
        rs.getString("education"),
        rs.getString("skills"),
        rs.getString("location"),
        rs.getInt("experience_years"),
        rs.getString("phone"),
        rs.getString("linkedin"),
        rs.getString("github")
    );

    private static final RowMapper<InternshipPosting> POSTING_MAPPER = (rs, rowNum) -> new InternshipPosting(
        rs.getLong("id"),
        rs.getString("title"),
        rs.getString("company"),
        rs.getString("location"),
        rs.getString("description"),
        rs.getString("required_skills"),
        rs.getString("preferred_skills"),
        rs.getString("duration"),
        rs.getString("stipend"),
        rs.getString("application_deadline"),
        rs.getString("posted_date"),
        rs.getBoolean("is_active"),
        rs.getString("min_education"),
        rs.getInt("experience_required")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public RecommendationJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    @Override
    public CandidateProfile findProfileById(long profileId) {
        List<CandidateProfile> rows = jdbc.query(
            """
                SELECT id, email, name, education, skills, location, experience_years,
                       phone, linkedin, github
                FROM candidates
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", profileId),
            PROFILE_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public List<InternshipPosting> findActivePostings() {
        return jdbc.query(
            """
                SELECT id, title, company, location, description, required_skills,
                       preferred_skills, duration, stipend, application_deadline, posted_date,
                       is_active, min_education, experience_required
                FROM internships
                WHERE is_active = TRUE
                ORDER BY id
                """,
            new MapSqlParameterSource(),
            POSTING_MAPPER
        );
    }
}
