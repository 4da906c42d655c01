package com.interngenie.gateway.insights.model;

public record PopularInternship(
    long internshipId,
    String title,
    String company,
    int applicationCount,
    double successRate
) {
}
