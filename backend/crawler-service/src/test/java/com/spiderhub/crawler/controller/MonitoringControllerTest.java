package com.spiderhub.crawler.controller;

import com.spiderhub.crawler.dto.ComponentHealth;
import com.spiderhub.crawler.dto.HealthCheckResponse;
import com.spiderhub.crawler.dto.TaskStatsResponse;
import com.spiderhub.crawler.entity.TaskStatus;
import com.spiderhub.crawler.service.InfrastructureHealthService;
import com.spiderhub.crawler.service.RateLimiterService;
import com.spiderhub.crawler.service.TaskRegistry;
import com.spiderhub.crawler.service.TaskStatsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({MonitoringController.class, RootController.class})
@Import(MonitoringControllerTest.MetricsConfig.class)
@ActiveProfiles("test")
class MonitoringControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InfrastructureHealthService healthService;

    @MockBean
    private TaskStatsService taskStatsService;

    @MockBean
    private TaskRegistry taskRegistry;

    @MockBean
    private RateLimiterService rateLimiterService;

    @Test
    @DisplayName("GET /api/v1/monitoring/health - 모두 정상이면 200")
    void healthy() throws Exception {
        when(healthService.check()).thenReturn(health(true));

        mockMvc.perform(get("/api/v1/monitoring/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.redis.healthy").value(true))
                .andExpect(jsonPath("$.database.latency_ms").value(1.5));
    }

    @Test
    @DisplayName("GET /api/v1/monitoring/health - DB 장애면 503")
    void unhealthy() throws Exception {
        when(healthService.check()).thenReturn(health(false));

        mockMvc.perform(get("/api/v1/monitoring/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("unhealthy"))
                .andExpect(jsonPath("$.database.healthy").value(false));
    }

    @Test
    @DisplayName("GET /api/v1/monitoring/metrics - 시스템/작업/Redis 메트릭")
    void metrics() throws Exception {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        counts.put(TaskStatus.RUNNING, 2L);
        counts.put(TaskStatus.COMPLETED, 1L);
        when(taskRegistry.countByStatus()).thenReturn(counts);
        when(taskRegistry.size()).thenReturn(3);
        when(healthService.redisInfo()).thenReturn(Map.of("redis_version", "7.2.4"));

        mockMvc.perform(get("/api/v1/monitoring/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.system").exists())
                .andExpect(jsonPath("$.application.total_tasks").value(3))
                .andExpect(jsonPath("$.application.running_tasks").value(2))
                .andExpect(jsonPath("$.application.completed_tasks").value(1))
                .andExpect(jsonPath("$.redis.redis_version").value("7.2.4"));
    }

    @Test
    @DisplayName("GET /api/v1/monitoring/stats - 작업 통계")
    void stats() throws Exception {
        when(taskStatsService.getStats()).thenReturn(new TaskStatsResponse(
                new TaskStatsResponse.Overview(4, 120, 66.67),
                Map.of("completed", 2L, "failed", 1L, "running", 1L),
                List.of()));

        mockMvc.perform(get("/api/v1/monitoring/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overview.total_tasks").value(4))
                .andExpect(jsonPath("$.overview.total_items").value(120))
                .andExpect(jsonPath("$.overview.success_rate").value(66.67))
                .andExpect(jsonPath("$.status_breakdown.completed").value(2));
    }

    @Test
    @DisplayName("GET / 와 GET /health")
    void rootEndpoints() throws Exception {
        when(healthService.check()).thenReturn(health(false));

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.api").value("/api/v1/spiders"));
        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable());
    }

    private static HealthCheckResponse health(boolean databaseUp) {
        ComponentHealth redis = ComponentHealth.builder().name("Redis").healthy(true).message("Connected").latencyMs(0.8).build();
        ComponentHealth database = databaseUp
                ? ComponentHealth.builder().name("Database").healthy(true).message("Connected").latencyMs(1.5).build()
                : ComponentHealth.builder().name("Database").healthy(false).message("Connection failed: refused").build();
        return new HealthCheckResponse(
                databaseUp ? HealthCheckResponse.HEALTHY : HealthCheckResponse.UNHEALTHY,
                redis, database, Instant.now(), "1.0.0");
    }

    @TestConfiguration
    static class MetricsConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }
}
