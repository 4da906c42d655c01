package com.interngenie.gateway.insights.model;

import java.util.List;
import java.util.Map;

public record CollaborativeInsights(
    List<SimilarUser> similarUsers,
    List<PopularInternship> popularInternships,
    Map<String, List<String>> skillCorrelations
) {
}
