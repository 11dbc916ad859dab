package com.spiderhub.crawler.service;

import com.spiderhub.crawler.config.CrawlerProperties;
import com.spiderhub.crawler.exception.InfrastructureUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 고정 윈도우 요청 제한 테스트 (Redis 값은 맵으로 대체)
 */
@ExtendWith(MockitoExtension.class)
class RateLimiterServiceTest {

    private static final String CLIENT = "10.0.0.1";
    private static final String KEY = "rate_limit:10.0.0.1";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final Map<String, String> values = new ConcurrentHashMap<>();

    private RateLimiterService rateLimiter;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        // INCR 은 Redis 처럼 원자적으로 동작
        lenient().when(valueOperations.increment(anyString()))
                .thenAnswer(invocation -> Long.parseLong(values.merge(invocation.getArgument(0), "1",
                        (current, one) -> String.valueOf(Long.parseLong(current) + 1))));
        lenient().when(redisTemplate.getExpire(eq(KEY), eq(TimeUnit.SECONDS))).thenReturn(42L);

        CrawlerProperties properties = new CrawlerProperties();
        properties.getRateLimit().setRequestsPerWindow(3);
        properties.getRateLimit().setWindow(Duration.ofSeconds(60));
        rateLimiter = new RateLimiterService(redisTemplate, properties);
    }

    @Test
    @DisplayName("윈도우당 3회까지 허용, 4번째 요청은 거부")
    void ceilingWithinWindow() {
        // when
        RateLimiterService.Decision first = rateLimiter.tryAcquire(CLIENT);
        RateLimiterService.Decision second = rateLimiter.tryAcquire(CLIENT);
        RateLimiterService.Decision third = rateLimiter.tryAcquire(CLIENT);
        RateLimiterService.Decision fourth = rateLimiter.tryAcquire(CLIENT);

        // then
        assertThat(first.allowed()).isTrue();
        assertThat(first.count()).isEqualTo(1);
        assertThat(second.allowed()).isTrue();
        assertThat(third.allowed()).isTrue();
        assertThat(third.remaining()).isZero();

        assertThat(fourth.allowed()).isFalse();
        assertThat(fourth.retryAfterSeconds()).isEqualTo(42L);
        assertThat(fourth.remaining()).isZero();
        verify(redisTemplate, times(1)).expire(KEY, Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("윈도우 만료 후 카운터는 1부터 다시 시작")
    void resetsAfterWindow() {
        // given
        for (int i = 0; i < 4; i++) {
            rateLimiter.tryAcquire(CLIENT);
        }

        // when: key expired
        values.remove(KEY);
        RateLimiterService.Decision decision = rateLimiter.tryAcquire(CLIENT);

        // then
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.count()).isEqualTo(1);
        assertThat(values).containsEntry(KEY, "1");
    }

    @Test
    @DisplayName("클라이언트별로 독립된 카운터")
    void independentClients() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire(CLIENT);
        }

        assertThat(rateLimiter.tryAcquire(CLIENT).allowed()).isFalse();
        assertThat(rateLimiter.tryAcquire("10.0.0.2").allowed()).isTrue();
    }

    @Test
    @DisplayName("남은 TTL 을 알 수 없으면 윈도우 길이로 재시도 안내")
    void retryAfterFallsBackToWindow() {
        when(redisTemplate.getExpire(eq(KEY), eq(TimeUnit.SECONDS))).thenReturn(-1L);
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire(CLIENT);
        }

        assertThat(rateLimiter.tryAcquire(CLIENT).retryAfterSeconds()).isEqualTo(60L);
        // 만료 시간이 없는 카운터는 다시 만료를 건다
        verify(redisTemplate, times(2)).expire(KEY, Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("동시 요청이 몰려도 윈도우 상한을 넘겨 허용하지 않음")
    void concurrentBurstRespectsCeiling() throws Exception {
        // given
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(1);
        List<Callable<Boolean>> requests = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            requests.add(() -> {
                ready.await();
                return rateLimiter.tryAcquire(CLIENT).allowed();
            });
        }

        // when
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (Callable<Boolean> request : requests) {
                futures.add(pool.submit(request));
            }
            ready.countDown();

            // then
            long allowed = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    allowed++;
                }
            }
            assertThat(allowed).isEqualTo(3);
            assertThat(values).containsEntry(KEY, String.valueOf(callers));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Redis 장애 시 503 예외")
    void redisDown() {
        when(valueOperations.increment(anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThatThrownBy(() -> rateLimiter.tryAcquire(CLIENT))
                .isInstanceOf(InfrastructureUnavailableException.class);
    }
}
