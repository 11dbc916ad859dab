package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record HealthCheckResponse(
        String status,
        ComponentHealth redis,
        ComponentHealth database,
        Instant timestamp,
        String version
) {
    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
