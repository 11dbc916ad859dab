package com.spiderhub.crawler.service;

import com.spiderhub.crawler.config.CrawlerProperties;
import com.spiderhub.crawler.dto.ResultPage;
import com.spiderhub.crawler.dto.SpiderRunRequest;
import com.spiderhub.crawler.dto.TaskView;
import com.spiderhub.crawler.entity.TaskStatus;
import com.spiderhub.crawler.exception.InvalidRequestException;
import com.spiderhub.crawler.exception.SpiderLaunchException;
import com.spiderhub.crawler.exception.TaskNotFoundException;
import com.spiderhub.crawler.exception.TaskNotStoppableException;
import com.spiderhub.crawler.service.runtime.JobHandle;
import com.spiderhub.crawler.service.runtime.JobResult;
import com.spiderhub.crawler.service.runtime.JobRuntime;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spider Task Orchestrator
 *
 * 작업 생성, 상태 조회, 중지, 결과 조회를 담당하는 파사드.
 * - 실행은 fire-and-forget: 호출자는 task_id 만 받는다
 * - 엔진의 완료 신호는 레지스트리의 조건부 전이(complete/fail)로만 반영된다
 * - 중지는 STOPPING 으로 바꾼 뒤 엔진 정리를 제한 시간까지 기다리고 STOPPED 로 확정한다
 */
@Service
@Slf4j
public class CrawlTaskOrchestrator {

    public static final int MAX_PAGE_SIZE = 1000;

    private final TaskRegistry taskRegistry;
    private final JobRuntime jobRuntime;
    private final ResultStore resultStore;
    private final CrawlResultIngestService ingestService;
    private final TaskCallbackNotifier callbackNotifier;
    private final Executor executor;
    private final Duration stopTimeout;

    private final Counter tasksStarted;
    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksStopped;
    private final Counter stopTimeouts;

    public CrawlTaskOrchestrator(TaskRegistry taskRegistry,
                                 JobRuntime jobRuntime,
                                 ResultStore resultStore,
                                 CrawlResultIngestService ingestService,
                                 TaskCallbackNotifier callbackNotifier,
                                 CrawlerProperties properties,
                                 MeterRegistry meterRegistry,
                                 @Qualifier("orchestratorExecutor") Executor executor) {
        this.taskRegistry = taskRegistry;
        this.jobRuntime = jobRuntime;
        this.resultStore = resultStore;
        this.ingestService = ingestService;
        this.callbackNotifier = callbackNotifier;
        this.executor = executor;
        this.stopTimeout = properties.getRuntime().getStopTimeout();

        this.tasksStarted = Counter.builder("crawler.tasks.started")
                .description("Spider tasks launched")
                .register(meterRegistry);
        this.tasksCompleted = Counter.builder("crawler.tasks.completed")
                .description("Spider tasks that finished normally")
                .register(meterRegistry);
        this.tasksFailed = Counter.builder("crawler.tasks.failed")
                .description("Spider tasks that failed or could not be launched")
                .register(meterRegistry);
        this.tasksStopped = Counter.builder("crawler.tasks.stopped")
                .description("Spider tasks stopped on request")
                .register(meterRegistry);
        this.stopTimeouts = Counter.builder("crawler.tasks.stop.timeouts")
                .description("Stops finalized without teardown confirmation")
                .register(meterRegistry);

        for (TaskStatus status : TaskStatus.values()) {
            Gauge.builder("crawler.tasks.current", taskRegistry, registry -> registry.countByStatus().get(status))
                    .tag("status", status.toValue())
                    .description("Tasks currently held in the registry")
                    .register(meterRegistry);
        }
    }

    // ========================================
    // Launch
    // ========================================

    /**
     * Register a task and hand it to the engine. Returns as soon as the job is
     * submitted. A launch failure is recorded on the task, not thrown.
     *
     * @throws InvalidRequestException if no spider with that name exists
     */
    public String startTask(SpiderRunRequest request) {
        String spiderName = request.spiderName();
        Set<String> spiders = jobRuntime.getSpiderNames();
        if (!spiders.contains(spiderName)) {
            throw InvalidRequestException.unknownSpider(spiderName, spiders);
        }

        String taskId = taskRegistry.create(spiderName, request.spiderKwargs());
        log.info("Starting spider task: taskId={}, spider={}, priority={}, timeout={}s",
                taskId, spiderName, request.priority(), request.timeout());

        JobHandle handle;
        try {
            handle = jobRuntime.launch(spiderName, taskId, request.spiderKwargs());
        } catch (SpiderLaunchException e) {
            log.error("Failed to launch spider: taskId={}, spider={}", taskId, spiderName, e);
            if (taskRegistry.fail(taskId, e.getMessage())) {
                tasksFailed.increment();
                notifyClosed(taskId);
            }
            return taskId;
        }

        taskRegistry.markRunning(taskId);
        tasksStarted.increment();

        // callbacks are attached after RUNNING so a fast job cannot complete a PENDING task
        handle.onComplete(result -> onJobCompleted(taskId, result), executor);
        handle.onFail(error -> onJobFailed(taskId, error), executor);
        return taskId;
    }

    private void onJobCompleted(String taskId, JobResult result) {
        if (taskRegistry.complete(taskId, result.toSummary())) {
            tasksCompleted.increment();
            log.info("Task completed: taskId={}, reason={}, items={}",
                    taskId, result.closeReason(), result.itemsScraped());
            notifyClosed(taskId);
        } else {
            log.debug("Completion signal ignored: taskId={}, reason={}", taskId, result.closeReason());
        }
    }

    private void onJobFailed(String taskId, Throwable error) {
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        if (taskRegistry.fail(taskId, reason)) {
            tasksFailed.increment();
            log.warn("Task failed: taskId={}, reason={}", taskId, reason);
            notifyClosed(taskId);
        } else {
            log.debug("Failure signal ignored: taskId={}, reason={}", taskId, reason);
        }
    }

    // ========================================
    // Stop
    // ========================================

    /**
     * RUNNING -> STOPPING, ask the engine to tear the job down, then
     * STOPPING -> STOPPED once teardown is confirmed or the stop timeout
     * elapses.
     *
     * @throws TaskNotFoundException     unknown task id
     * @throws TaskNotStoppableException task is not RUNNING
     */
    public CompletableFuture<TaskView> stopTask(String taskId) {
        if (!taskRegistry.beginStop(taskId)) {
            TaskView current = taskRegistry.get(taskId)
                    .orElseThrow(() -> new TaskNotFoundException(taskId));
            throw new TaskNotStoppableException(taskId, current.status());
        }

        Optional<JobHandle> handle = jobRuntime.findHandle(taskId);
        if (handle.isEmpty()) {
            log.warn("No runtime handle for stopping task, finalizing directly: taskId={}", taskId);
            return CompletableFuture.completedFuture(finalizeStop(taskId));
        }

        return jobRuntime.requestStop(handle.get())
                .orTimeout(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handleAsync((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        if (cause instanceof TimeoutException) {
                            stopTimeouts.increment();
                            log.warn("Spider did not confirm teardown within {}s, forcing STOPPED: taskId={}",
                                    stopTimeout.toSeconds(), taskId);
                        } else {
                            log.warn("Spider teardown failed, forcing STOPPED: taskId={}, error={}",
                                    taskId, cause.getMessage());
                        }
                    }
                    return finalizeStop(taskId);
                }, executor);
    }

    private TaskView finalizeStop(String taskId) {
        if (taskRegistry.finalizeStop(taskId)) {
            tasksStopped.increment();
            log.info("Task stopped: taskId={}", taskId);
            notifyClosed(taskId);
        }
        return taskRegistry.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private void notifyClosed(String taskId) {
        taskRegistry.get(taskId).ifPresent(callbackNotifier::notifyClosed);
    }

    // ========================================
    // Records
    // ========================================

    public void ingest(String taskId, List<Map<String, Object>> records) {
        ingestService.deliver(taskId, records);
    }

    /**
     * @throws TaskNotFoundException   unknown task id
     * @throws InvalidRequestException start below 0 or limit outside 1..1000
     */
    public ResultPage getResults(String taskId, long start, int limit) {
        if (start < 0) {
            throw InvalidRequestException.pagination("start must be >= 0");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw InvalidRequestException.pagination("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (taskRegistry.get(taskId).isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }
        return resultStore.read(taskId, start, limit);
    }

    // ========================================
    // Queries
    // ========================================

    public Optional<TaskView> getTask(String taskId) {
        return taskRegistry.get(taskId);
    }

    public Map<String, TaskView> listTasks() {
        return taskRegistry.listAll();
    }

    public Set<String> getSpiderNames() {
        return jobRuntime.getSpiderNames();
    }

    @PreDestroy
    public void shutdown() {
        List<CompletableFuture<TaskView>> stops = new ArrayList<>();
        for (TaskView task : taskRegistry.listAll().values()) {
            if (task.status() != TaskStatus.RUNNING) {
                continue;
            }
            try {
                stops.add(stopTask(task.taskId()));
            } catch (TaskNotStoppableException | TaskNotFoundException e) {
                log.debug("Task finished before shutdown could stop it: taskId={}", task.taskId());
            }
        }
        if (stops.isEmpty()) {
            return;
        }

        log.info("Stopping {} running tasks before shutdown", stops.size());
        try {
            CompletableFuture.allOf(stops.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.warn("Some tasks could not be stopped cleanly: {}", e.getMessage());
        }
    }
}
