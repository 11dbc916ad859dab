package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * 스파이더 실행 요청.
 * priority, timeout 은 검증만 하고 오케스트레이터가 아직 강제하지 않는다.
 */
public record SpiderRunRequest(
        @JsonProperty("spider_name")
        @NotBlank(message = "spider_name must not be blank")
        String spiderName,

        @JsonProperty("spider_kwargs")
        Map<String, Object> spiderKwargs,

        @Min(1) @Max(10)
        Integer priority,

        @Min(60)
        Integer timeout
) {
    public static final int DEFAULT_PRIORITY = 1;
    public static final int DEFAULT_TIMEOUT_SECONDS = 3600;

    public SpiderRunRequest {
        spiderName = spiderName == null ? null : spiderName.strip();
        spiderKwargs = spiderKwargs == null ? Map.of() : spiderKwargs;
        priority = priority == null ? DEFAULT_PRIORITY : priority;
        timeout = timeout == null ? DEFAULT_TIMEOUT_SECONDS : timeout;
    }

    public static SpiderRunRequest of(String spiderName, Map<String, Object> spiderKwargs) {
        return new SpiderRunRequest(spiderName, spiderKwargs, null, null);
    }
}
