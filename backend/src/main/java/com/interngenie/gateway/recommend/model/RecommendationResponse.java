package com.interngenie.gateway.recommend.model;

import java.util.List;

public record RecommendationResponse(
    boolean success,
    List<ScoredRecommendation> recommendations,
    int total,
    String message
) {
}
