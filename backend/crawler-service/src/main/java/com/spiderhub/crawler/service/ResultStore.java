package com.spiderhub.crawler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spiderhub.crawler.config.CrawlerProperties;
import com.spiderhub.crawler.dto.ResultPage;
import com.spiderhub.crawler.exception.CrawlerException;
import com.spiderhub.crawler.exception.InfrastructureUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Crawl Result Store
 *
 * 작업별 수집 결과를 Redis 리스트(crawl_results:{taskId})에 JSON으로 추가하고
 * offset/limit 으로 조회합니다.
 * - 추가할 때마다 만료 시간을 갱신 (조회는 갱신하지 않음)
 * - Redis 장애 시 데이터를 버리지 않고 503 예외를 던짐
 */
@Service
@Slf4j
public class ResultStore {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;

    public ResultStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, CrawlerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getResults().getKeyPrefix();
        this.ttl = properties.getResults().getTtl();
    }

    public String keyFor(String taskId) {
        return keyPrefix + taskId;
    }

    /**
     * Append records in order and push the key's expiry out to now + ttl.
     */
    public void append(String taskId, List<Map<String, Object>> records) {
        if (records == null || records.isEmpty()) {
            return;
        }

        String key = keyFor(taskId);
        List<String> payloads = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            payloads.add(serialize(taskId, record));
        }

        try {
            redisTemplate.opsForList().rightPushAll(key, payloads);
            redisTemplate.expire(key, ttl);
            log.debug("Stored crawl results: taskId={}, count={}", taskId, payloads.size());
        } catch (DataAccessException e) {
            log.error("Failed to store crawl results: taskId={}, count={}, error={}",
                    taskId, payloads.size(), e.getMessage());
            throw InfrastructureUnavailableException.redis("Failed to store crawl results for task " + taskId, e);
        }
    }

    /**
     * Records [offset, offset + limit) in insertion order, plus the total count.
     */
    public ResultPage read(String taskId, long offset, int limit) {
        String key = keyFor(taskId);
        try {
            long end = offset > Long.MAX_VALUE - limit ? Long.MAX_VALUE : offset + limit - 1;
            List<String> raw = redisTemplate.opsForList().range(key, offset, end);
            Long size = redisTemplate.opsForList().size(key);

            List<Map<String, Object>> items = new ArrayList<>();
            if (raw != null) {
                for (String payload : raw) {
                    items.add(deserialize(taskId, payload));
                }
            }
            return new ResultPage(items, offset, limit, size == null ? 0L : size);
        } catch (DataAccessException e) {
            log.error("Failed to read crawl results: taskId={}, error={}", taskId, e.getMessage());
            throw InfrastructureUnavailableException.redis("Failed to read crawl results for task " + taskId, e);
        }
    }

    private String serialize(String taskId, Map<String, Object> record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new CrawlerException("SERIALIZATION_ERROR",
                    "Record of task " + taskId + " is not serializable", e);
        }
    }

    private Map<String, Object> deserialize(String taskId, String payload) {
        try {
            return objectMapper.readValue(payload, RECORD_TYPE);
        } catch (JsonProcessingException e) {
            throw new CrawlerException("SERIALIZATION_ERROR",
                    "Stored record of task " + taskId + " is not valid JSON", e);
        }
    }
}
