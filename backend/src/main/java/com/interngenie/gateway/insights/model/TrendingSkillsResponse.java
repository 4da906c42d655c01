package com.interngenie.gateway.insights.model;

import java.util.List;

public record TrendingSkillsResponse(boolean success, List<TrendingSkill> skills, String message) {}
