package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SpiderTaskResponse(
        @JsonProperty("task_id") String taskId,
        String status,
        String message,
        @JsonProperty("spider_name") String spiderName,
        @JsonProperty("created_at") Instant createdAt
) {}
