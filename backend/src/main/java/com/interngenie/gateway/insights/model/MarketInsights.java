package com.interngenie.gateway.insights.model;

import java.util.List;
import java.util.Map;

public record MarketInsights(
    int totalApplications,
    double successRate,
    Map<String, Integer> popularCompanies,
    List<String> trendingSkills,
    Map<String, Integer> locationDistribution
) {
}
