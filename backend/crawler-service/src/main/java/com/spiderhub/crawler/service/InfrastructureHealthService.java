package com.spiderhub.crawler.service;

import com.spiderhub.crawler.dto.ComponentHealth;
import com.spiderhub.crawler.dto.HealthCheckResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Redis / 관계형 DB 연결 상태 확인
 */
@Service
@Slf4j
public class InfrastructureHealthService {

    private static final List<String> REDIS_INFO_KEYS = List.of(
            "redis_version", "connected_clients", "used_memory_human", "uptime_in_seconds");

    private final RedisConnectionFactory redisConnectionFactory;
    private final JdbcTemplate jdbcTemplate;
    private final String version;

    public InfrastructureHealthService(RedisConnectionFactory redisConnectionFactory,
                                       JdbcTemplate jdbcTemplate,
                                       @Value("${info.app.version:1.0.0}") String version) {
        this.redisConnectionFactory = redisConnectionFactory;
        this.jdbcTemplate = jdbcTemplate;
        this.version = version;
    }

    public HealthCheckResponse check() {
        ComponentHealth redis = checkRedis();
        ComponentHealth database = checkDatabase();
        String status = redis.isHealthy() && database.isHealthy()
                ? HealthCheckResponse.HEALTHY
                : HealthCheckResponse.UNHEALTHY;
        return new HealthCheckResponse(status, redis, database, Instant.now(), version);
    }

    public ComponentHealth checkRedis() {
        long started = System.nanoTime();
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            connection.ping();
            return ComponentHealth.builder()
                    .name("Redis")
                    .healthy(true)
                    .message("Connected")
                    .latencyMs(elapsedMillis(started))
                    .build();
        } catch (Exception e) {
            log.error("Redis health check failed: {}", e.getMessage());
            return ComponentHealth.builder()
                    .name("Redis")
                    .healthy(false)
                    .message("Connection failed: " + e.getMessage())
                    .build();
        }
    }

    public ComponentHealth checkDatabase() {
        long started = System.nanoTime();
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return ComponentHealth.builder()
                    .name("Database")
                    .healthy(true)
                    .message("Connected")
                    .latencyMs(elapsedMillis(started))
                    .build();
        } catch (Exception e) {
            log.error("Database health check failed: {}", e.getMessage());
            return ComponentHealth.builder()
                    .name("Database")
                    .healthy(false)
                    .message("Connection failed: " + e.getMessage())
                    .build();
        }
    }

    /**
     * Selected fields of Redis INFO. Returns an "error" entry when Redis is down.
     */
    public Map<String, Object> redisInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        try (RedisConnection connection = redisConnectionFactory.getConnection()) {
            Properties properties = connection.serverCommands().info();
            if (properties != null) {
                for (String key : REDIS_INFO_KEYS) {
                    String value = properties.getProperty(key);
                    if (value != null) {
                        info.put(key, value);
                    }
                }
            }
        } catch (Exception e) {
            log.warn("Failed to read Redis INFO: {}", e.getMessage());
            info.put("error", e.getMessage());
        }
        return info;
    }

    private static double elapsedMillis(long startedNanos) {
        return Math.round((System.nanoTime() - startedNanos) / 10_000.0) / 100.0;
    }
}
