package com.interngenie.gateway.insights.model;

import java.util.List;
import java.util.Map;

public record UserInsights(
    int totalInteractions,
    Map<String, Integer> actionBreakdown,
    Map<String, Integer> preferredSkills,
    Map<String, Integer> preferredCompanies,
    Map<String, Integer> preferredLocations,
    double applicationSuccessRate,
    List<String> learningRecommendations
) {
}
