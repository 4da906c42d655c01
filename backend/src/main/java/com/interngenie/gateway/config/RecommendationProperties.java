package com.interngenie.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recommendation")
public class RecommendationProperties {
    private int defaultLimit = 5;
    private int scoringParallelism = 1;
    private int parallelThreshold = 64;
    private Insights insights = new Insights();

    public int getDefaultLimit() {
        return Math.max(0, defaultLimit);
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = Math.max(0, defaultLimit);
    }

    public int getScoringParallelism() {
        return Math.max(1, scoringParallelism);
    }

    public void setScoringParallelism(int scoringParallelism) {
        this.scoringParallelism = Math.max(1, scoringParallelism);
    }

    public int getParallelThreshold() {
        return Math.max(1, parallelThreshold);
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = Math.max(1, parallelThreshold);
    }

    public boolean isParallelScoring() {
        return getScoringParallelism() > 1;
    }

    public Insights getInsights() {
        return insights;
    }

    public void setInsights(Insights insights) {
        this.insights = insights;
    }

    public static class Insights {
        private int trendingSkillsDefaultLimit = 10;

        public int getTrendingSkillsDefaultLimit() {
            return Math.max(1, trendingSkillsDefaultLimit);
        }

        public void setTrendingSkillsDefaultLimit(int trendingSkillsDefaultLimit) {
            this.trendingSkillsDefaultLimit = Math.max(1, trendingSkillsDefaultLimit);
        }
    }
}
