package com.spiderhub.crawler.service.spider;

import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * 크롤 작업 정의.
 *
 * 구현체는 @Component 로 등록하면 SpiderRegistry 가 이름으로 찾아 실행한다.
 * crawl() 이 반환하는 Flux 는 구독될 때마다 새로 시작해야 하며,
 * 취소(dispose)되면 즉시 방출을 멈춰야 한다.
 */
public interface Spider {

    /**
     * Unique spider name used in launch requests (e.g. "example_spider")
     */
    String getName();

    /**
     * Stream of raw items for one job. Items pass through the item pipeline
     * before they are stored.
     */
    Flux<Map<String, Object>> crawl(SpiderContext context);

    default String getDescription() {
        return getName();
    }
}
