package com.interngenie.gateway.insights.model;

import java.util.List;

public record SimilarUser(long userId, double similarityScore, List<String> commonSkills) {}
