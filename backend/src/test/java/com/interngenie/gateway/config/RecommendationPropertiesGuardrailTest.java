package com.interngenie.gateway.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecommendationPropertiesGuardrailTest {

    @Test
    void defaultsMatchDocumentedValues() {
        RecommendationProperties properties = new RecommendationProperties();
        assertEquals(5, properties.getDefaultLimit());
        assertEquals(1, properties.getScoringParallelism());
        assertFalse(properties.isParallelScoring());
        assertEquals(10, properties.getInsights().getTrendingSkillsDefaultLimit());
    }

    @Test
    void limitsAndParallelismAreClamped() {
        RecommendationProperties properties = new RecommendationProperties();
        properties.setDefaultLimit(-3);
        properties.setScoringParallelism(0);
        properties.setParallelThreshold(-1);
        assertEquals(0, properties.getDefaultLimit());
        assertEquals(1, properties.getScoringParallelism());
        assertEquals(1, properties.getParallelThreshold());

        properties.setScoringParallelism(8);
        assertTrue(properties.isParallelScoring());
    }
}
