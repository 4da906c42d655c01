package com.interngenie.gateway.insights.model;

public record ApplicationStats(long total, long accepted) {
    public double successRate() {
        return total > 0 ? (double) accepted / total : 0.0;
    }
}
