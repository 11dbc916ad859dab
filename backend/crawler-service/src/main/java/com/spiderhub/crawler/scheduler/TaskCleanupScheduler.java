package com.spiderhub.crawler.scheduler;

import com.spiderhub.crawler.config.CrawlerProperties;
import com.spiderhub.crawler.service.TaskRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * 오래된 종료 작업을 레지스트리에서 제거한다.
 * Redis 결과는 자체 TTL 로 만료되므로 여기서는 건드리지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskCleanupScheduler {

    private final TaskRegistry taskRegistry;
    private final CrawlerProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${crawler.tasks.cleanup-interval-ms:600000}",
            initialDelayString = "${crawler.tasks.cleanup-interval-ms:600000}")
    public void evictExpiredTasks() {
        Instant cutoff = clock.instant().minus(properties.getTasks().getRetention());
        int evicted = taskRegistry.evictTerminatedBefore(cutoff);
        if (evicted > 0) {
            log.info("Evicted {} terminated tasks older than {} (remaining={})",
                    evicted, properties.getTasks().getRetention(), taskRegistry.size());
        }
    }
}
