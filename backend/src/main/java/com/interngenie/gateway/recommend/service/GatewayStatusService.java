package com.interngenie.gateway.recommend.service;

import com.interngenie.gateway.recommend.model.HealthResponse;
import com.interngenie.gateway.recommend.persistence.RecommendationJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class GatewayStatusService {
    public static final String SERVICE_NAME = "interngenie-gateway";

    private static final Logger log = LoggerFactory.getLogger(GatewayStatusService.class);
    private final RecommendationJdbcRepository repository;

    public GatewayStatusService(RecommendationJdbcRepository repository) {
        this.repository = repository;
    }

    public HealthResponse getHealth() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database reachability check failed", e);
            dbConnected = false;
        }
        return new HealthResponse("healthy", SERVICE_NAME, Instant.now(), dbConnected);
    }
}
