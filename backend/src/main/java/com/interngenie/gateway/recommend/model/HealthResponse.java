package com.interngenie.gateway.recommend.model;

import java.time.Instant;

public record HealthResponse(String status, String service, Instant timestamp, boolean dbConnectivity) {}
