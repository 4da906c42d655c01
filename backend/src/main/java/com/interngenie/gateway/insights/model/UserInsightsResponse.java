package com.interngenie.gateway.insights.model;

public record UserInsightsResponse(boolean success, UserInsights insights, String message) {}
