package com.spiderhub.crawler.service.pipeline;

import com.spiderhub.crawler.service.spider.SpiderContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemPipelineTest {

    private final SpiderContext context = new SpiderContext("task-1", "example_spider", Map.of(), 1000);

    @Test
    @DisplayName("http/https URL 만 통과")
    void validation() {
        ValidationPipeline pipeline = new ValidationPipeline();

        assertThat(pipeline.process(Map.of("url", "https://example.com"), context)).containsKey("url");
        assertThat(pipeline.process(Map.of("url", "http://example.com"), context)).containsKey("url");

        assertThatThrownBy(() -> pipeline.process(Map.of("title", "no url"), context))
                .isInstanceOf(DropItemException.class)
                .hasMessageContaining("Missing url");
        assertThatThrownBy(() -> pipeline.process(Map.of("url", "  "), context))
                .isInstanceOf(DropItemException.class);
        assertThatThrownBy(() -> pipeline.process(Map.of("url", "ftp://example.com"), context))
                .isInstanceOf(DropItemException.class)
                .hasMessageContaining("ftp://example.com");
    }

    @Test
    @DisplayName("url:title 이 같은 아이템은 두 번째부터 제거")
    void duplicates() {
        DuplicatesPipeline pipeline = new DuplicatesPipeline();
        Map<String, Object> item = Map.of("url", "https://example.com/a", "title", "A");

        pipeline.process(item, context);
        pipeline.process(Map.of("url", "https://example.com/a", "title", "B"), context);

        assertThatThrownBy(() -> pipeline.process(new HashMap<>(item), context))
                .isInstanceOf(DropItemException.class);
    }

    @Test
    @DisplayName("지문은 SHA-256 16진수 문자열")
    void fingerprint() {
        String fingerprint = DuplicatesPipeline.fingerprint(Map.of("url", "https://example.com", "title", "t"));

        assertThat(fingerprint).hasSize(64).matches("[0-9a-f]+");
        assertThat(DuplicatesPipeline.fingerprint(Map.of("url", "https://example.com", "title", "t")))
                .isEqualTo(fingerprint);
    }

    @Test
    @DisplayName("수집 시각, 스파이더 이름, 작업 ID 추가")
    void enrichment() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        EnrichmentPipeline pipeline = new EnrichmentPipeline(Clock.fixed(now, ZoneOffset.UTC));

        Map<String, Object> enriched = pipeline.process(Map.of("url", "https://example.com"), context);

        assertThat(enriched)
                .containsEntry("url", "https://example.com")
                .containsEntry("crawled_at", "2024-05-01T12:00:00Z")
                .containsEntry("spider_name", "example_spider")
                .containsEntry("task_id", "task-1");
    }

    @Test
    @DisplayName("작업마다 독립된 파이프라인 체인")
    void factoryCreatesFreshChains() {
        ItemPipelineFactory factory = new ItemPipelineFactory(Clock.systemUTC());

        List<ItemPipeline> first = factory.create();
        List<ItemPipeline> second = factory.create();

        assertThat(first).hasSize(3);
        assertThat(first.get(0)).isInstanceOf(ValidationPipeline.class);
        assertThat(first.get(1)).isInstanceOf(DuplicatesPipeline.class);
        assertThat(first.get(2)).isInstanceOf(EnrichmentPipeline.class);
        assertThat(first.get(1)).isNotSameAs(second.get(1));
    }
}
