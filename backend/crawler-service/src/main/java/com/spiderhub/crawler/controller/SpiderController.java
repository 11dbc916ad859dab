package com.spiderhub.crawler.controller;

import com.spiderhub.crawler.dto.ResultPageResponse;
import com.spiderhub.crawler.dto.SpiderRunRequest;
import com.spiderhub.crawler.dto.SpiderTaskResponse;
import com.spiderhub.crawler.dto.StopTaskResponse;
import com.spiderhub.crawler.dto.TaskView;
import com.spiderhub.crawler.exception.TaskNotFoundException;
import com.spiderhub.crawler.service.CrawlTaskOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST Controller for spider tasks.
 * Launch, status, results and stop of crawl jobs.
 */
@RestController
@RequestMapping("/api/v1/spiders")
@RequiredArgsConstructor
@Slf4j
public class SpiderController {

    private final CrawlTaskOrchestrator orchestrator;

    @GetMapping({"", "/"})
    public ResponseEntity<List<String>> listSpiders() {
        return ResponseEntity.ok(new ArrayList<>(orchestrator.getSpiderNames()));
    }

    // ============================================
    // Launch
    // ============================================

    /**
     * Start a spider. Returns immediately with the task id; progress is
     * polled through /tasks/{taskId}.
     */
    @PostMapping("/run")
    public ResponseEntity<SpiderTaskResponse> runSpider(@Valid @RequestBody SpiderRunRequest request) {
        log.info("Spider run requested: spider={}, priority={}", request.spiderName(), request.priority());

        String taskId = orchestrator.startTask(request);
        TaskView task = orchestrator.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));

        return ResponseEntity.ok(new SpiderTaskResponse(
                taskId,
                "started",
                "Spider " + request.spiderName() + " started successfully",
                request.spiderName(),
                task.startTime()));
    }

    // ============================================
    // Task Status
    // ============================================

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskView> getTask(@PathVariable String taskId) {
        return orchestrator.getTask(taskId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @GetMapping("/tasks")
    public ResponseEntity<Map<String, TaskView>> listTasks() {
        return ResponseEntity.ok(orchestrator.listTasks());
    }

    // ============================================
    // Results
    // ============================================

    @GetMapping("/results/{taskId}")
    public ResponseEntity<ResultPageResponse> getResults(
            @PathVariable String taskId,
            @RequestParam(defaultValue = "0") @Min(0) long start,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit
    ) {
        return ResponseEntity.ok(ResultPageResponse.from(taskId, orchestrator.getResults(taskId, start, limit)));
    }

    // ============================================
    // Stop
    // ============================================

    /**
     * Stop a running task. Completes once the engine confirmed the teardown
     * or the stop timeout elapsed.
     */
    @PostMapping("/tasks/{taskId}/stop")
    public CompletableFuture<ResponseEntity<StopTaskResponse>> stopTask(@PathVariable String taskId) {
        log.info("Stop requested: taskId={}", taskId);
        return orchestrator.stopTask(taskId)
                .thenApply(task -> ResponseEntity.ok(new StopTaskResponse(
                        "Spider task " + taskId + " stopped",
                        taskId,
                        task.status())));
    }
}
