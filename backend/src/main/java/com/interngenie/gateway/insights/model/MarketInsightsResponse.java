package com.interngenie.gateway.insights.model;

public record MarketInsightsResponse(boolean success, MarketInsights insights, String message) {}
