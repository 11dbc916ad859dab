package com.spiderhub.crawler.controller;

import com.spiderhub.crawler.dto.HealthCheckResponse;
import com.spiderhub.crawler.service.InfrastructureHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class RootController {

    private final InfrastructureHealthService healthService;

    @Value("${spring.application.name:crawler-service}")
    private String applicationName;

    @Value("${info.app.version:1.0.0}")
    private String version;

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", applicationName);
        body.put("version", version);
        body.put("status", "running");
        body.put("api", "/api/v1/spiders");
        body.put("monitoring", "/api/v1/monitoring");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<HealthCheckResponse> health() {
        HealthCheckResponse health = healthService.check();
        return ResponseEntity.status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(health);
    }
}
