package com.spiderhub.crawler.dto;

import java.util.List;
import java.util.Map;

/**
 * One slice of a task's stored records.
 */
public record ResultPage(
        List<Map<String, Object>> items,
        long start,
        int limit,
        long total
) {
    public ResultPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasMore() {
        return start < total && limit < total - start;
    }
}
