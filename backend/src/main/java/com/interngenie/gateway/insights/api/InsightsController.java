package com.interngenie.gateway.insights.api;

import com.interngenie.gateway.insights.model.CollaborativeInsightsResponse;
import com.interngenie.gateway.insights.model.MarketInsightsResponse;
import com.interngenie.gateway.insights.model.TrendingSkillsResponse;
import com.interngenie.gateway.insights.model.UserInsightsResponse;
import com.interngenie.gateway.insights.service.InsightsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class InsightsController {
    private final InsightsService insightsService;

    public InsightsController(InsightsService insightsService) {
        this.insightsService = insightsService;
    }

    @GetMapping("/profiles/{profileId}/insights")
    public UserInsightsResponse getUserInsights(@PathVariable("profileId") long profileId) {
        return insightsService.getUserInsights(profileId);
    }

    @GetMapping("/market-insights")
    public MarketInsightsResponse getMarketInsights() {
        return insightsService.getMarketInsights();
    }

    @GetMapping("/collaborative-insights")
    public CollaborativeInsightsResponse getCollaborativeInsights() {
        return insightsService.getCollaborativeInsights();
    }

    @GetMapping("/trending-skills")
    public TrendingSkillsResponse getTrendingSkills(@RequestParam(name = "limit", required = false) Integer limit) {
        if (limit != null && limit < 0) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must not be negative");
        }
        return insightsService.getTrendingSkills(limit);
    }
}
