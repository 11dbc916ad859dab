package com.spiderhub.crawler.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spiderhub.crawler.config.CrawlerProperties;
import com.spiderhub.crawler.dto.ResultPage;
import com.spiderhub.crawler.exception.InfrastructureUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ResultStore 단위 테스트 (Redis 리스트는 메모리 리스트로 대체)
 */
@ExtendWith(MockitoExtension.class)
class ResultStoreTest {

    private static final String TASK_ID = "task-1";
    private static final String KEY = "crawl_results:task-1";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ListOperations<String, String> listOperations;

    private final List<String> backing = new ArrayList<>();

    private ResultStore resultStore;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForList()).thenReturn(listOperations);
        lenient().when(listOperations.rightPushAll(eq(KEY), anyCollection())).thenAnswer(invocation -> {
            Collection<String> values = invocation.getArgument(1);
            backing.addAll(values);
            return (long) backing.size();
        });
        lenient().when(listOperations.range(eq(KEY), anyLong(), anyLong())).thenAnswer(invocation -> {
            long start = invocation.getArgument(1);
            long end = invocation.getArgument(2);
            int from = (int) Math.min(start, backing.size());
            int to = (int) Math.min(end + 1, backing.size());
            return new ArrayList<>(backing.subList(from, Math.max(from, to)));
        });
        lenient().when(listOperations.size(KEY)).thenAnswer(invocation -> (long) backing.size());

        resultStore = new ResultStore(redisTemplate, new ObjectMapper(), new CrawlerProperties());
    }

    @Test
    @DisplayName("추가 시 순서대로 저장하고 만료 시간 갱신")
    void appendRefreshesExpiry() {
        // when
        resultStore.append(TASK_ID, records(0, 3));
        resultStore.append(TASK_ID, records(3, 2));

        // then
        assertThat(backing).hasSize(5);
        assertThat(backing.get(0)).contains("\"n\":0");
        assertThat(backing.get(4)).contains("\"n\":4");
        verify(redisTemplate, times(2)).expire(KEY, Duration.ofHours(1));
    }

    @Test
    @DisplayName("빈 배치는 Redis 를 호출하지 않음")
    void emptyBatchIsNoop() {
        resultStore.append(TASK_ID, List.of());

        verify(listOperations, never()).rightPushAll(anyString(), anyCollection());
        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("연속 페이지는 겹치지 않고 마지막 페이지에서 has_more=false")
    void paginationDoesNotOverlap() {
        // given
        resultStore.append(TASK_ID, records(0, 25));

        // when
        ResultPage first = resultStore.read(TASK_ID, 0, 10);
        ResultPage second = resultStore.read(TASK_ID, 10, 10);
        ResultPage last = resultStore.read(TASK_ID, 20, 10);

        // then
        assertThat(first.items()).extracting(item -> item.get("n")).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertThat(second.items()).extracting(item -> item.get("n"))
                .containsExactly(10, 11, 12, 13, 14, 15, 16, 17, 18, 19);
        assertThat(last.items()).extracting(item -> item.get("n")).containsExactly(20, 21, 22, 23, 24);

        assertThat(first.total()).isEqualTo(25);
        assertThat(first.hasMore()).isTrue();
        assertThat(second.hasMore()).isTrue();
        assertThat(last.hasMore()).isFalse();
    }

    @Test
    @DisplayName("결과가 없는 작업은 빈 페이지")
    void readMissingKey() {
        ResultPage page = resultStore.read(TASK_ID, 0, 100);

        assertThat(page.items()).isEmpty();
        assertThat(page.total()).isZero();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    @DisplayName("시작 위치가 long 최대값 근처여도 범위가 넘치지 않고 has_more=false")
    void farOffsetDoesNotOverflow() {
        // given
        resultStore.append(TASK_ID, records(0, 5));
        long offset = Long.MAX_VALUE - 10;

        // when
        ResultPage page = resultStore.read(TASK_ID, offset, 100);

        // then
        verify(listOperations).range(KEY, offset, Long.MAX_VALUE);
        assertThat(page.items()).isEmpty();
        assertThat(page.total()).isEqualTo(5);
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    @DisplayName("Redis 장애 시 레코드를 버리지 않고 예외 발생")
    void redisFailureSurfaces() {
        // given
        when(listOperations.rightPushAll(eq(KEY), anyCollection()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        // when & then
        assertThatThrownBy(() -> resultStore.append(TASK_ID, records(0, 1)))
                .isInstanceOf(InfrastructureUnavailableException.class)
                .hasMessageContaining(TASK_ID);
    }

    private static List<Map<String, Object>> records(int from, int count) {
        return IntStream.range(from, from + count)
                .<Map<String, Object>>mapToObj(n -> Map.of("n", n, "url", "https://example.com/" + n))
                .toList();
    }
}
