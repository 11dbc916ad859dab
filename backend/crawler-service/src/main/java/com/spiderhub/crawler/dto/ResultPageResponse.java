package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ResultPageResponse(
        @JsonProperty("task_id") String taskId,
        List<Map<String, Object>> items,
        Pagination pagination
) {
    public static ResultPageResponse from(String taskId, ResultPage page) {
        return new ResultPageResponse(
                taskId,
                page.items(),
                new Pagination(page.start(), page.limit(), page.total(), page.hasMore()));
    }

    public record Pagination(
            long start,
            int limit,
            long total,
            @JsonProperty("has_more") boolean hasMore
    ) {}
}
