package com.spiderhub.crawler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record TaskStatsResponse(
        Overview overview,
        @JsonProperty("status_breakdown") Map<String, Long> statusBreakdown,
        @JsonProperty("recent_tasks") List<TaskView> recentTasks
) {
    public record Overview(
            @JsonProperty("total_tasks") long totalTasks,
            @JsonProperty("total_items") long totalItems,
            @JsonProperty("success_rate") double successRate
    ) {}
}
