package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.spiderhub.crawler.entity.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a task record, safe to hand out of the registry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("spider_name") String spiderName,
        Map<String, Object> kwargs,
        TaskStatus status,
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("items_count") long itemsCount,
        @JsonProperty("failure_reason") String failureReason,
        Map<String, Object> result
) {

    /**
     * Seconds between start and end; null while the task is still live.
     */
    @JsonProperty("execution_time")
    public Double executionTime() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime).toMillis() / 1000.0;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
