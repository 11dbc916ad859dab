package com.spiderhub.crawler.service.spider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Demo spider. Produces one synthetic item per seed URL and page without
 * touching the network.
 *
 * kwargs:
 * - start_urls: list or comma separated string (default https://httpbin.org/json)
 * - pages: items per seed URL (default 1)
 * - delay_ms: pause before each item (default 100)
 */
@Component
@Slf4j
public class ExampleSpider implements Spider {

    public static final String NAME = "example_spider";

    static final List<String> DEFAULT_START_URLS = List.of("https://httpbin.org/json");
    static final long DEFAULT_DELAY_MS = 100L;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Synthetic items for each start URL, no network access";
    }

    @Override
    public Flux<Map<String, Object>> crawl(SpiderContext context) {
        List<String> startUrls = context.getStringList("start_urls", DEFAULT_START_URLS);
        long pages = Math.max(1L, context.getLong("pages", 1L));
        long delayMs = Math.max(0L, context.getLong("delay_ms", DEFAULT_DELAY_MS));

        log.debug("Example spider starting: taskId={}, urls={}, pages={}, delayMs={}",
                context.taskId(), startUrls.size(), pages, delayMs);

        Flux<Map<String, Object>> items = Flux.fromIterable(startUrls)
                .concatMap(url -> Flux.range(1, (int) Math.min(pages, Integer.MAX_VALUE))
                        .map(page -> toItem(url, page, pages)));

        if (delayMs == 0) {
            return items;
        }
        return items.delayElements(Duration.ofMillis(delayMs));
    }

    private Map<String, Object> toItem(String url, int page, long pages) {
        String pageUrl = pages > 1 ? url + (url.contains("?") ? "&" : "?") + "page=" + page : url;

        Map<String, Object> item = new LinkedHashMap<>();
        item.put("url", pageUrl);
        item.put("title", "Example item " + page + " from " + url);
        item.put("content", "Synthetic content for " + pageUrl);
        item.put("page", page);
        return item;
    }
}
