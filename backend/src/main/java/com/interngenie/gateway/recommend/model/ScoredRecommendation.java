package com.interngenie.gateway.recommend.model;

public record ScoredRecommendation(
    InternshipPosting internship,
    double score,
    String explanation
) {
}
