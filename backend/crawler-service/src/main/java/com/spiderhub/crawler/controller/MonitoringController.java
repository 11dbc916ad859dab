package com.spiderhub.crawler.controller;

import com.spiderhub.crawler.dto.HealthCheckResponse;
import com.spiderhub.crawler.dto.TaskStatsResponse;
import com.spiderhub.crawler.entity.TaskStatus;
import com.spiderhub.crawler.service.InfrastructureHealthService;
import com.spiderhub.crawler.service.TaskRegistry;
import com.spiderhub.crawler.service.TaskStatsService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 모니터링 컨트롤러
 *
 * 의존 서비스 상태, 시스템/애플리케이션 메트릭, 작업 통계를 제공합니다.
 */
@RestController
@RequestMapping("/api/v1/monitoring")
@RequiredArgsConstructor
@Slf4j
public class MonitoringController {

    private final InfrastructureHealthService healthService;
    private final TaskStatsService taskStatsService;
    private final TaskRegistry taskRegistry;
    private final MeterRegistry meterRegistry;

    /**
     * Redis + DB 상태. 하나라도 실패하면 503
     */
    @GetMapping("/health")
    public ResponseEntity<HealthCheckResponse> getHealth() {
        HealthCheckResponse health = healthService.check();
        HttpStatus status = health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    /**
     * 메트릭 요약
     */
    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> getMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();

        // 시스템 메트릭 (Actuator 가 등록한 JVM/프로세스 미터)
        Map<String, Object> system = new LinkedHashMap<>();
        system.put("cpu_usage", getGaugeValue("system.cpu.usage"));
        system.put("process_cpu_usage", getGaugeValue("process.cpu.usage"));
        system.put("cpu_count", getGaugeValue("system.cpu.count"));
        system.put("memory_used_bytes", sumGauges("jvm.memory.used"));
        system.put("memory_max_bytes", sumGauges("jvm.memory.max"));
        system.put("live_threads", getGaugeValue("jvm.threads.live"));
        system.put("uptime_seconds", getGaugeValue("process.uptime"));
        metrics.put("system", system);

        // 작업 메트릭
        Map<String, Object> application = new LinkedHashMap<>();
        Map<TaskStatus, Long> counts = taskRegistry.countByStatus();
        application.put("total_tasks", taskRegistry.size());
        application.put("running_tasks", counts.get(TaskStatus.RUNNING));
        application.put("completed_tasks", counts.get(TaskStatus.COMPLETED));
        application.put("failed_tasks", counts.get(TaskStatus.FAILED));
        application.put("stopped_tasks", counts.get(TaskStatus.STOPPED));
        application.put("launched_total", getCounterValue("crawler.tasks.started"));
        application.put("stop_timeouts_total", getCounterValue("crawler.tasks.stop.timeouts"));
        metrics.put("application", application);

        metrics.put("redis", healthService.redisInfo());

        return ResponseEntity.ok(metrics);
    }

    @GetMapping("/stats")
    public ResponseEntity<TaskStatsResponse> getStats() {
        return ResponseEntity.ok(taskStatsService.getStats());
    }

    private double getCounterValue(String name) {
        var counter = meterRegistry.find(name).counter();
        return counter != null ? counter.count() : 0;
    }

    private double getGaugeValue(String name) {
        var gauge = meterRegistry.find(name).gauge();
        return gauge != null ? gauge.value() : 0;
    }

    private double sumGauges(String name) {
        return meterRegistry.find(name).gauges().stream()
                .mapToDouble(Gauge::value)
                .filter(value -> !Double.isNaN(value) && value >= 0)
                .sum();
    }
}
