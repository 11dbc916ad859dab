package com.spiderhub.crawler.service;

import com.spiderhub.crawler.config.CrawlerProperties;
import com.spiderhub.crawler.exception.InfrastructureUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 고정 윈도우 요청 카운터 (클라이언트 키별).
 *
 * 요청마다 먼저 INCR 하고, 결과가 1이면 윈도우 만료 시간을 설정한다.
 * INCR 결과가 상한을 넘으면 윈도우가 끝날 때까지 거부한다.
 * 윈도우 경계에서 짧은 버스트는 허용된다.
 */
@Service
@Slf4j
public class RateLimiterService {

    private final StringRedisTemplate redisTemplate;
    private final boolean enabled;
    private final String keyPrefix;
    private final int requestsPerWindow;
    private final Duration window;

    public RateLimiterService(StringRedisTemplate redisTemplate, CrawlerProperties properties) {
        this.redisTemplate = redisTemplate;
        CrawlerProperties.RateLimit config = properties.getRateLimit();
        this.enabled = config.isEnabled();
        this.keyPrefix = config.getKeyPrefix();
        this.requestsPerWindow = config.getRequestsPerWindow();
        this.window = config.getWindow();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getRequestsPerWindow() {
        return requestsPerWindow;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Count one request for the client and decide whether it may proceed.
     */
    public Decision tryAcquire(String clientKey) {
        String key = keyPrefix + clientKey;
        try {
            Long updated = redisTemplate.opsForValue().increment(key);
            long count = updated == null ? 1L : updated;
            if (count == 1L) {
                redisTemplate.expire(key, window);
            }

            if (count > requestsPerWindow) {
                Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
                long retryAfter;
                if (ttl != null && ttl > 0) {
                    retryAfter = ttl;
                } else {
                    // counter lost its expiry (INCR succeeded, EXPIRE did not)
                    redisTemplate.expire(key, window);
                    retryAfter = window.toSeconds();
                }
                log.debug("Rate limit exceeded: client={}, count={}, retryAfter={}s", clientKey, count, retryAfter);
                return Decision.rejected(count, requestsPerWindow, retryAfter);
            }
            return Decision.allowed(count, requestsPerWindow);
        } catch (DataAccessException e) {
            log.error("Rate limiter unavailable: client={}, error={}", clientKey, e.getMessage());
            throw InfrastructureUnavailableException.redis("Rate limiter backend unavailable", e);
        }
    }

    public record Decision(boolean allowed, long count, int limit, long retryAfterSeconds) {

        static Decision allowed(long count, int limit) {
            return new Decision(true, count, limit, 0L);
        }

        static Decision rejected(long count, int limit, long retryAfterSeconds) {
            return new Decision(false, count, limit, retryAfterSeconds);
        }

        public long remaining() {
            return Math.max(0L, limit - count);
        }
    }
}
