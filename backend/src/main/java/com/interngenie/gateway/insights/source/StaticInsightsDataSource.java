package com.interngenie.gateway.insights.source;

import com.interngenie.gateway.insights.model.PopularInternship;
import com.interngenie.gateway.insights.model.SimilarUser;
import com.interngenie.gateway.insights.model.TrendingSkill;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed demonstration figures.
 */
@Component
public class StaticInsightsDataSource implements InsightsDataSource {
    private static final double APPLICATION_SUCCESS_RATE = 0.75;

    private static final List<String> LEARNING_RECOMMENDATIONS = List.of(
        "Focus on Python and Machine Learning skills",
        "Consider gaining experience with cloud platforms",
        "Develop your leadership and communication skills"
    );

    private static final List<TrendingSkill> TRENDING_SKILLS = List.of(
        new TrendingSkill("Python", 450, 0.25),
        new TrendingSkill("Machine Learning", 320, 0.35),
        new TrendingSkill("React", 280, 0.18),
        new TrendingSkill("AWS", 250, 0.42),
        new TrendingSkill("Docker", 200, 0.30)
    );

    @Override
    public double applicationSuccessRate(long profileId) {
        return APPLICATION_SUCCESS_RATE;
    }

    @Override
    public List<String> learningRecommendations(long profileId) {
        return LEARNING_RECOMMENDATIONS;
    }

    @Override
    public Map<String, Integer> popularCompanies() {
        Map<String, Integer> companies = new LinkedHashMap<>();
        companies.put("Google", 45);
        companies.put("Microsoft", 38);
        companies.put("Amazon", 32);
        return companies;
    }

    @Override
    public List<String> trendingSkillNames() {
        return TRENDING_SKILLS.stream().map(TrendingSkill::skill).toList();
    }

    @Override
    public Map<String, Integer> locationDistribution() {
        Map<String, Integer> locations = new LinkedHashMap<>();
        locations.put("San Francisco", 120);
        locations.put("New York", 95);
        locations.put("Seattle", 78);
        return locations;
    }

    @Override
    public List<SimilarUser> similarUsers() {
        return List.of(
            new SimilarUser(123, 0.85, List.of("Python", "Machine Learning")),
            new SimilarUser(456, 0.78, List.of("React", "JavaScript"))
        );
    }

    @Override
    public List<PopularInternship> popularInternships() {
        return List.of(
            new PopularInternship(1, "Software Engineering Intern", "Google", 150, 0.12),
            new PopularInternship(2, "Data Science Intern", "Microsoft", 120, 0.15)
        );
    }

    @Override
    public Map<String, List<String>> skillCorrelations() {
        Map<String, List<String>> correlations = new LinkedHashMap<>();
        correlations.put("Python", List.of("Machine Learning", "Data Science"));
        correlations.put("React", List.of("JavaScript", "Node.js"));
        return correlations;
    }

    @Override
    public List<TrendingSkill> trendingSkills() {
        return TRENDING_SKILLS;
    }
}
