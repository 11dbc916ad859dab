package com.spiderhub.crawler.service.runtime;

import com.spiderhub.crawler.config.CrawlerProperties;
import com.spiderhub.crawler.exception.SpiderLaunchException;
import com.spiderhub.crawler.service.pipeline.DropItemException;
import com.spiderhub.crawler.service.pipeline.ItemPipeline;
import com.spiderhub.crawler.service.pipeline.ItemPipelineFactory;
import com.spiderhub.crawler.service.spider.Spider;
import com.spiderhub.crawler.service.spider.SpiderContext;
import com.spiderhub.crawler.service.spider.SpiderRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Crawl engine backed by Reactor.
 *
 * 모든 스파이더는 단일 스레드 스케줄러(crawl-engine) 위에서 협력적으로 실행된다.
 * 아이템은 파이프라인을 거쳐 배치로 묶인 뒤 boundedElastic 에서 RecordSink 로 전달된다.
 * 배치 전달은 concatMap 으로 직렬화되므로 작업별 순서가 유지된다.
 */
@Component
@Slf4j
public class ReactorJobRuntime implements JobRuntime {

    private final SpiderRegistry spiderRegistry;
    private final ItemPipelineFactory pipelineFactory;
    private final RecordSink recordSink;
    private final Scheduler engine;
    private final int batchSize;
    private final Duration flushInterval;
    private final int defaultMaxItems;

    private final Map<String, EngineJob> liveJobs = new ConcurrentHashMap<>();

    public ReactorJobRuntime(SpiderRegistry spiderRegistry,
                             ItemPipelineFactory pipelineFactory,
                             RecordSink recordSink,
                             @Qualifier("crawlEngineScheduler") Scheduler engine,
                             CrawlerProperties properties) {
        this.spiderRegistry = spiderRegistry;
        this.pipelineFactory = pipelineFactory;
        this.recordSink = recordSink;
        this.engine = engine;
        this.batchSize = properties.getRuntime().getBatchSize();
        this.flushInterval = properties.getRuntime().getFlushInterval();
        this.defaultMaxItems = properties.getRuntime().getDefaultMaxItems();
    }

    @Override
    public JobHandle launch(String spiderName, String taskId, Map<String, Object> kwargs) {
        Spider spider = spiderRegistry.find(spiderName)
                .orElseThrow(() -> new SpiderLaunchException(spiderName, "Unknown spider: " + spiderName));

        SpiderContext context = createContext(spiderName, taskId, kwargs);
        EngineJob job = new EngineJob(taskId, spiderName, context.maxItems());
        if (liveJobs.putIfAbsent(taskId, job) != null) {
            throw new SpiderLaunchException(spiderName, "Task is already running: " + taskId);
        }

        try {
            Flux<Void> flow = buildFlow(spider, context, pipelineFactory.create(), job);
            job.subscription.update(flow.subscribe(
                    null,
                    job::fail,
                    job::finish));
        } catch (RuntimeException e) {
            liveJobs.remove(taskId, job);
            throw new SpiderLaunchException(spiderName, "Failed to start spider " + spiderName + ": " + e.getMessage(), e);
        }

        log.info("Launched spider job: taskId={}, spider={}, maxItems={}", taskId, spiderName, context.maxItems());
        return job;
    }

    @Override
    public Optional<JobHandle> findHandle(String taskId) {
        return Optional.ofNullable(liveJobs.get(taskId));
    }

    @Override
    public CompletableFuture<Void> requestStop(JobHandle handle) {
        EngineJob job = liveJobs.get(handle.getTaskId());
        if (job == null) {
            log.debug("Stop requested for job that already tore down: taskId={}", handle.getTaskId());
            return CompletableFuture.completedFuture(null);
        }

        log.info("Stopping spider job: taskId={}, spider={}", job.taskId, job.spiderName);
        try {
            // dispose on the engine thread so it never interleaves with item processing
            engine.schedule(job.subscription::dispose);
        } catch (RejectedExecutionException e) {
            log.warn("Engine scheduler rejected stop, disposing directly: taskId={}", job.taskId);
            job.subscription.dispose();
        }
        return job.terminated.copy();
    }

    @Override
    public Set<String> getSpiderNames() {
        return spiderRegistry.getNames();
    }

    int getLiveJobCount() {
        return liveJobs.size();
    }

    @PreDestroy
    public void destroy() {
        if (liveJobs.isEmpty()) {
            return;
        }
        log.info("Disposing {} live spider jobs", liveJobs.size());
        liveJobs.values().forEach(job -> job.subscription.dispose());
    }

    private SpiderContext createContext(String spiderName, String taskId, Map<String, Object> kwargs) {
        SpiderContext base = new SpiderContext(taskId, spiderName, kwargs, defaultMaxItems);
        long maxItems;
        try {
            maxItems = base.getLong(SpiderContext.MAX_ITEMS_KWARG, defaultMaxItems);
        } catch (IllegalArgumentException e) {
            throw new SpiderLaunchException(spiderName, e.getMessage(), e);
        }
        if (maxItems < 1 || maxItems > Integer.MAX_VALUE) {
            throw new SpiderLaunchException(spiderName, "max_items must be a positive integer: " + maxItems);
        }
        return new SpiderContext(taskId, spiderName, kwargs, (int) maxItems);
    }

    private Flux<Void> buildFlow(Spider spider, SpiderContext context, List<ItemPipeline> pipelines, EngineJob job) {
        return Flux.defer(() -> spider.crawl(context))
                .subscribeOn(engine)
                .publishOn(engine)
                .<Map<String, Object>>handle((item, sink) -> {
                    Map<String, Object> processed = applyPipelines(item, context, pipelines, job);
                    if (processed != null) {
                        sink.next(processed);
                    }
                })
                .take(context.maxItems())
                .doOnNext(item -> job.itemsScraped.incrementAndGet())
                .bufferTimeout(batchSize, flushInterval, engine)
                .concatMap(batch -> Mono.<Void>fromRunnable(() -> recordSink.deliver(job.taskId, batch))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doFinally(signal -> job.tearDown(signal));
    }

    private Map<String, Object> applyPipelines(Map<String, Object> item,
                                               SpiderContext context,
                                               List<ItemPipeline> pipelines,
                                               EngineJob job) {
        Map<String, Object> current = item;
        for (ItemPipeline pipeline : pipelines) {
            try {
                current = pipeline.process(current, context);
            } catch (DropItemException e) {
                job.itemsDropped.incrementAndGet();
                log.warn("Dropped item: taskId={}, pipeline={}, reason={}",
                        job.taskId, pipeline.getClass().getSimpleName(), e.getMessage());
                return null;
            } catch (RuntimeException e) {
                // 파이프라인 오류는 해당 아이템만 버리고 작업은 계속한다
                job.errorCount.incrementAndGet();
                log.error("Item pipeline error: taskId={}, pipeline={}",
                        job.taskId, pipeline.getClass().getSimpleName(), e);
                return null;
            }
        }
        return current;
    }

    private final class EngineJob implements JobHandle {
        private final String taskId;
        private final String spiderName;
        private final int maxItems;
        private final CompletableFuture<JobResult> completion = new CompletableFuture<>();
        private final CompletableFuture<Void> terminated = new CompletableFuture<>();
        private final Disposable.Swap subscription = Disposables.swap();
        private final AtomicLong itemsScraped = new AtomicLong();
        private final AtomicLong itemsDropped = new AtomicLong();
        private final AtomicLong errorCount = new AtomicLong();
        private final long startedNanos = System.nanoTime();

        private EngineJob(String taskId, String spiderName, int maxItems) {
            this.taskId = taskId;
            this.spiderName = spiderName;
            this.maxItems = maxItems;
        }

        @Override
        public String getTaskId() {
            return taskId;
        }

        @Override
        public String getSpiderName() {
            return spiderName;
        }

        @Override
        public CompletableFuture<JobResult> completion() {
            return completion;
        }

        private void finish() {
            String reason = itemsScraped.get() >= maxItems ? JobResult.MAX_ITEMS_REACHED : JobResult.FINISHED;
            JobResult result = summarize(reason);
            log.info("Spider job closed: taskId={}, reason={}, scraped={}, dropped={}, errors={}, duration={}ms",
                    taskId, reason, result.itemsScraped(), result.itemsDropped(), result.errorCount(),
                    result.duration().toMillis());
            completion.complete(result);
        }

        private JobResult summarize(String reason) {
            return new JobResult(reason, itemsScraped.get(), itemsDropped.get(), errorCount.get(),
                    Duration.ofNanos(System.nanoTime() - startedNanos));
        }

        private void fail(Throwable error) {
            log.error("Spider job failed: taskId={}, spider={}", taskId, spiderName, error);
            completion.completeExceptionally(error);
        }

        private void tearDown(SignalType signal) {
            if (signal == SignalType.CANCEL) {
                JobResult result = summarize(JobResult.SHUTDOWN);
                log.info("Spider job cancelled: taskId={}, scraped={}", taskId, result.itemsScraped());
                completion.complete(result);
            }
            liveJobs.remove(taskId, this);
            terminated.complete(null);
        }
    }
}
