package com.spiderhub.crawler.service.spider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExampleSpiderTest {

    private final ExampleSpider spider = new ExampleSpider();

    @Test
    @DisplayName("기본 시작 URL 로 아이템 하나를 생성")
    void defaultStartUrl() {
        SpiderContext context = new SpiderContext("task-1", ExampleSpider.NAME, Map.of("delay_ms", 0), 1000);

        StepVerifier.create(spider.crawl(context))
                .assertNext(item -> {
                    assertThat(item).containsEntry("url", "https://httpbin.org/json");
                    assertThat(item).containsKeys("title", "content");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("시작 URL 과 페이지 수만큼 순서대로 생성")
    void urlsAndPages() {
        SpiderContext context = new SpiderContext("task-1", ExampleSpider.NAME, Map.of(
                "start_urls", List.of("https://a.example", "https://b.example"),
                "pages", 2,
                "delay_ms", 0), 1000);

        StepVerifier.create(spider.crawl(context).map(item -> item.get("url")))
                .expectNext("https://a.example?page=1", "https://a.example?page=2")
                .expectNext("https://b.example?page=1", "https://b.example?page=2")
                .verifyComplete();
    }

    @Test
    @DisplayName("delay_ms 간격으로 방출 (가상 시간)")
    void delayBetweenItems() {
        SpiderContext context = new SpiderContext("task-1", ExampleSpider.NAME,
                Map.of("start_urls", "https://a.example, https://b.example", "delay_ms", 500), 1000);

        StepVerifier.withVirtualTime(() -> spider.crawl(context))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(499))
                .thenAwait(Duration.ofMillis(1))
                .expectNextCount(1)
                .thenAwait(Duration.ofMillis(500))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    @DisplayName("SpiderContext kwargs 변환")
    void contextKwargs() {
        SpiderContext context = new SpiderContext("task-1", ExampleSpider.NAME,
                Map.of("count", "7", "urls", "a, ,b", "bad", "x"), 10);

        assertThat(context.getLong("count", 1)).isEqualTo(7);
        assertThat(context.getLong("missing", 3)).isEqualTo(3);
        assertThat(context.getStringList("urls", List.of())).containsExactly("a", "b");
        assertThat(context.getString("missing", "fallback")).isEqualTo("fallback");
        assertThatThrownBy(() -> context.getLong("bad", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("같은 이름의 스파이더가 두 개면 등록 실패")
    void registryRejectsDuplicates() {
        assertThatThrownBy(() -> new SpiderRegistry(List.of(new ExampleSpider(), new ExampleSpider())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(ExampleSpider.NAME);

        SpiderRegistry registry = new SpiderRegistry(List.of(spider));
        assertThat(registry.contains(ExampleSpider.NAME)).isTrue();
        assertThat(registry.contains(null)).isFalse();
        assertThat(registry.find(ExampleSpider.NAME)).containsSame(spider);
    }
}
