package com.interngenie.gateway.insights.model;

public record TrendingSkill(String skill, int frequency, double growthRate) {}
