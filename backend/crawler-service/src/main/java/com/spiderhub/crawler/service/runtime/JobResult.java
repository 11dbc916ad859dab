package com.spiderhub.crawler.service.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary a job reports when it closes normally.
 */
public record JobResult(
        String closeReason,
        long itemsScraped,
        long itemsDropped,
        long errorCount,
        Duration duration
) {
    public static final String FINISHED = "finished";
    public static final String MAX_ITEMS_REACHED = "max_items_reached";
    public static final String SHUTDOWN = "shutdown";

    public JobResult {
        duration = duration == null ? Duration.ZERO : duration;
    }

    public JobResult(String closeReason, long itemsScraped, long itemsDropped) {
        this(closeReason, itemsScraped, itemsDropped, 0L, Duration.ZERO);
    }

    public Map<String, Object> toSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("close_reason", closeReason);
        summary.put("items_scraped", itemsScraped);
        summary.put("items_dropped", itemsDropped);
        summary.put("error_count", errorCount);
        summary.put("duration_seconds", duration.toMillis() / 1000.0);
        return summary;
    }
}
