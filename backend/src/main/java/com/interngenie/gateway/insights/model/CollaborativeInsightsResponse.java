package com.interngenie.gateway.insights.model;

public record CollaborativeInsightsResponse(boolean success, CollaborativeInsights insights, String message) {}
