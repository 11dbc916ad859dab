package com.spiderhub.crawler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Value("${async.orchestrator.core-pool-size:2}")
    private int corePoolSize;

    @Value("${async.orchestrator.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${async.orchestrator.queue-capacity:500}")
    private int queueCapacity;

    /**
     * 작업 완료/중지 콜백 실행자 (크롤 엔진 스레드를 막지 않도록 분리)
     */
    @Bean(name = "orchestratorExecutor")
    public Executor orchestratorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("crawl-orchestrator-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        // 포화 시 호출 스레드에서 실행: 상태 전이 콜백은 버려지면 안 된다
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 모든 스파이더가 공유하는 단일 스레드 크롤 엔진
     */
    @Bean(name = "crawlEngineScheduler", destroyMethod = "dispose")
    public Scheduler crawlEngineScheduler() {
        return Schedulers.newSingle("crawl-engine", true);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
