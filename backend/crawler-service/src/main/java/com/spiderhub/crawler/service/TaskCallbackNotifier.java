package com.spiderhub.crawler.service;

import com.spiderhub.crawler.config.CrawlerProperties;
import com.spiderhub.crawler.dto.TaskView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Task Callback Notifier
 *
 * 작업이 종료 상태가 되면 spider_kwargs.callback_url 로 작업 요약을 POST 한다.
 * - 전송은 비동기이며 결과는 로그로만 남긴다
 * - 콜백 실패가 작업 상태에 영향을 주지 않는다
 */
@Service
@Slf4j
public class TaskCallbackNotifier {

    public static final String CALLBACK_URL_KWARG = "callback_url";

    private final WebClient webClient;
    private final Clock clock;
    private final boolean enabled;
    private final Duration timeout;

    public TaskCallbackNotifier(WebClient webClient, Clock clock, CrawlerProperties properties) {
        this.webClient = webClient;
        this.clock = clock;
        this.enabled = properties.getCallback().isEnabled();
        this.timeout = properties.getCallback().getTimeout();
    }

    /**
     * Fire the callback for a task that just reached a terminal state. Never throws.
     */
    public void notifyClosed(TaskView task) {
        if (!enabled || !task.isTerminal()) {
            return;
        }
        Optional<URI> target = resolveCallbackUrl(task);
        if (target.isEmpty()) {
            return;
        }

        URI uri = target.get();
        try {
            webClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildPayload(task))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .subscribe(
                            response -> log.info("Task callback delivered: taskId={}, url={}, status={}",
                                    task.taskId(), uri, response.getStatusCode().value()),
                            error -> log.warn("Task callback failed: taskId={}, url={}, error={}",
                                    task.taskId(), uri, error.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Task callback could not be sent: taskId={}, url={}, error={}",
                    task.taskId(), uri, e.getMessage());
        }
    }

    Map<String, Object> buildPayload(TaskView task) {
        Map<String, Object> stats = new LinkedHashMap<>();
        if (task.result() != null) {
            stats.putAll(task.result());
        }
        stats.put("items_count", task.itemsCount());
        stats.put("start_time", task.startTime().toString());
        if (task.endTime() != null) {
            stats.put("end_time", task.endTime().toString());
        }
        if (!stats.containsKey("duration_seconds") && task.executionTime() != null) {
            stats.put("duration_seconds", task.executionTime());
        }
        if (task.failureReason() != null) {
            stats.put("failure_reason", task.failureReason());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.taskId());
        payload.put("spider_name", task.spiderName());
        payload.put("status", task.status().toValue());
        payload.put("stats", stats);
        payload.put("timestamp", clock.instant().toString());
        return payload;
    }

    private Optional<URI> resolveCallbackUrl(TaskView task) {
        Object value = task.kwargs() == null ? null : task.kwargs().get(CALLBACK_URL_KWARG);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(value.toString().trim());
            String scheme = uri.getScheme();
            if (uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                log.warn("Ignoring callback_url without http(s) host: taskId={}, url={}", task.taskId(), value);
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (URISyntaxException e) {
            log.warn("Ignoring malformed callback_url: taskId={}, url={}, error={}",
                    task.taskId(), value, e.getMessage());
            return Optional.empty();
        }
    }
}
