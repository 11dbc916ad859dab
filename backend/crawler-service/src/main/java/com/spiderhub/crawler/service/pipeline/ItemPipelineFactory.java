package com.spiderhub.crawler.service.pipeline;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * 작업마다 새 파이프라인 체인을 만든다 (중복 제거 상태가 작업 간에 섞이지 않도록).
 */
@Component
@RequiredArgsConstructor
public class ItemPipelineFactory {

    private final Clock clock;

    public List<ItemPipeline> create() {
        return List.of(
                new ValidationPipeline(),
                new DuplicatesPipeline(),
                new EnrichmentPipeline(clock));
    }
}
