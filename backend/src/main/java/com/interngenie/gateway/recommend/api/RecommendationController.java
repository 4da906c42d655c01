package com.interngenie.gateway.recommend.api;

import com.interngenie.gateway.recommend.model.HealthResponse;
import com.interngenie.gateway.recommend.model.RecommendationResponse;
import com.interngenie.gateway.recommend.service.GatewayStatusService;
import com.interngenie.gateway.recommend.service.RecommendationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class RecommendationController {
    private final RecommendationService recommendationService;
    private final GatewayStatusService statusService;

    public RecommendationController(RecommendationService recommendationService, GatewayStatusService statusService) {
        this.recommendationService = recommendationService;
        this.statusService = statusService;
    }

    @GetMapping("/health")
    public HealthResponse getHealth() {
        return statusService.getHealth();
    }

    @GetMapping("/profiles/{profileId}/recommendations")
    public RecommendationResponse getRecommendations(
        @PathVariable("profileId") long profileId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        if (limit != null && limit < 0) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must not be negative");
        }
        return recommendationService.recommend(profileId, limit);
    }
}
