package com.interngenie.gateway.insights.source;

import com.interngenie.gateway.insights.model.PopularInternship;
import com.interngenie.gateway.insights.model.SimilarUser;
import com.interngenie.gateway.insights.model.TrendingSkill;

import java.util.List;
import java.util.Map;

/**
 * Aggregates that are not yet computed from stored data. Swap the bean to back them with real
 * aggregation; the scoring path never reads from here.
 */
public interface InsightsDataSource {

    double applicationSuccessRate(long profileId);

    List<String> learningRecommendations(long profileId);

    Map<String, Integer> popularCompanies();

    List<String> trendingSkillNames();

    Map<String, Integer> locationDistribution();

    List<SimilarUser> similarUsers();

    List<PopularInternship> popularInternships();

    Map<String, List<String>> skillCorrelations();

    /**
     * @return trending skills, most relevant first
     */
    List<TrendingSkill> trendingSkills();
}
