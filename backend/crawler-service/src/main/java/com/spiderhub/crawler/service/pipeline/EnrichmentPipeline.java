package com.spiderhub.crawler.service.pipeline;

import com.spiderhub.crawler.service.spider.SpiderContext;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stamps crawl metadata onto each stored item.
 */
public class EnrichmentPipeline implements ItemPipeline {

    private final Clock clock;

    public EnrichmentPipeline(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Map<String, Object> process(Map<String, Object> item, SpiderContext context) {
        Map<String, Object> enriched = new LinkedHashMap<>(item);
        enriched.put("crawled_at", clock.instant().toString());
        enriched.put("spider_name", context.spiderName());
        enriched.put("task_id", context.taskId());
        return enriched;
    }
}
