package com.interngenie.gateway.insights.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interngenie.gateway.config.RecommendationProperties;
import com.interngenie.gateway.insights.model.ApplicationStats;
import com.interngenie.gateway.insights.model.CollaborativeInsights;
import com.interngenie.gateway.insights.model.CollaborativeInsightsResponse;
import com.interngenie.gateway.insights.model.MarketInsights;
import com.interngenie.gateway.insights.model.MarketInsightsResponse;
import com.interngenie.gateway.insights.model.TrendingSkill;
import com.interngenie.gateway.insights.model.TrendingSkillsResponse;
import com.interngenie.gateway.insights.model.UserInsights;
import com.interngenie.gateway.insights.model.UserInsightsResponse;
import com.interngenie.gateway.insights.persistence.InsightsJdbcRepository;
import com.interngenie.gateway.insights.source.InsightsDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class InsightsService {
    private static final Logger log = LoggerFactory.getLogger(InsightsService.class);

    private final InsightsJdbcRepository repository;
    private final InsightsDataSource dataSource;
    private final ObjectMapper objectMapper;
    private final RecommendationProperties properties;

    public InsightsService(
        InsightsJdbcRepository repository,
        InsightsDataSource dataSource,
        ObjectMapper objectMapper,
        RecommendationProperties properties
    ) {
        this.repository = repository;
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public UserInsightsResponse getUserInsights(long profileId) {
        List<String> documents = repository.findBehaviorDocuments(profileId);
        Map<String, Integer> actions = new LinkedHashMap<>();
        Map<String, Integer> skills = new LinkedHashMap<>();
        Map<String, Integer> companies = new LinkedHashMap<>();
        Map<String, Integer> locations = new LinkedHashMap<>();

        for (String document : documents) {
            JsonNode behavior = parseBehavior(profileId, document);
            if (behavior == null || !behavior.isObject()) {
                continue;
            }
            countText(actions, behavior.get("action"));
            JsonNode skillNodes = behavior.get("skills");
            if (skillNodes != null && skillNodes.isArray()) {
                for (JsonNode skill : skillNodes) {
                    countText(skills, skill);
                }
            }
            countText(companies, behavior.get("company"));
            countText(locations, behavior.get("location"));
        }

        UserInsights insights = new UserInsights(
            documents.size(),
            actions,
            skills,
            companies,
            locations,
            dataSource.applicationSuccessRate(profileId),
            dataSource.learningRecommendations(profileId)
        );
        return new UserInsightsResponse(true, insights, "User insights generated successfully");
    }

    public MarketInsightsResponse getMarketInsights() {
        ApplicationStats stats = repository.applicationStats();
        MarketInsights insights = new MarketInsights(
            (int) stats.total(),
            stats.successRate(),
            dataSource.popularCompanies(),
            dataSource.trendingSkillNames(),
            dataSource.locationDistribution()
        );
        return new MarketInsightsResponse(true, insights, "Market insights generated successfully");
    }

    public CollaborativeInsightsResponse getCollaborativeInsights() {
        CollaborativeInsights insights = new CollaborativeInsights(
            dataSource.similarUsers(),
            dataSource.popularInternships(),
            dataSource.skillCorrelations()
        );
        return new CollaborativeInsightsResponse(true, insights, "Collaborative insights generated successfully");
    }

    public TrendingSkillsResponse getTrendingSkills(Integer limit) {
        int safeLimit = limit == null
            ? properties.getInsights().getTrendingSkillsDefaultLimit()
            : Math.max(0, limit);
        List<TrendingSkill> skills = dataSource.trendingSkills().stream()
            .limit(safeLimit)
            .toList();
        return new TrendingSkillsResponse(true, skills, "Trending skills retrieved successfully");
    }

    private JsonNode parseBehavior(long profileId, String document) {
        if (document == null || document.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable behavior record for profile {}: {}", profileId, e.getOriginalMessage());
            return null;
        }
    }

    private static void countText(Map<String, Integer> counts, JsonNode node) {
        if (node == null || !node.isTextual()) {
            return;
        }
        counts.merge(node.asText(), 1, Integer::sum);
    }
}
