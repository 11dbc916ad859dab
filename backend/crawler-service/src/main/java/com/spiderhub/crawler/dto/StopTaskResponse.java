package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.spiderhub.crawler.entity.TaskStatus;

public record StopTaskResponse(
        String message,
        @JsonProperty("task_id") String taskId,
        TaskStatus status
) {}
