package com.spiderhub.crawler.service;

import com.spiderhub.crawler.dto.TaskView;
import com.spiderhub.crawler.entity.TaskStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory registry of spider tasks and owner of their state machine.
 *
 * <pre>
 * PENDING  -> RUNNING | FAILED
 * RUNNING  -> STOPPING | COMPLETED | FAILED
 * STOPPING -> STOPPED
 * </pre>
 *
 * Every mutation of a record happens under that record's monitor, so a
 * status check and the write that depends on it are never interleaved with
 * another transition. Completion and failure signals that arrive after a stop
 * was requested are ignored: the stop always wins.
 */
@Service
@Slf4j
public class TaskRegistry {

    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public TaskRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Allocate a PENDING task and return its id.
     */
    public String create(String spiderName, Map<String, Object> kwargs) {
        Map<String, Object> params = kwargs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));

        while (true) {
            String taskId = UUID.randomUUID().toString();
            TaskRecord record = new TaskRecord(taskId, spiderName, params, clock.instant());
            if (tasks.putIfAbsent(taskId, record) == null) {
                log.debug("Created task: taskId={}, spider={}", taskId, spiderName);
                return taskId;
            }
        }
    }

    public boolean markRunning(String taskId) {
        return transition(taskId, "mark_running", record -> {
            if (record.status != TaskStatus.PENDING) {
                return false;
            }
            record.status = TaskStatus.RUNNING;
            return true;
        });
    }

    /**
     * RUNNING -> COMPLETED. Ignored in any other state, in particular while a
     * stop is in progress or after it has been finalized.
     */
    public boolean complete(String taskId, Map<String, Object> result) {
        return transition(taskId, "complete", record -> {
            if (record.status != TaskStatus.RUNNING) {
                log.info("Ignoring completion of task {} in status {}", taskId, record.status);
                return false;
            }
            record.status = TaskStatus.COMPLETED;
            record.endTime = clock.instant();
            record.result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
            return true;
        });
    }

    /**
     * PENDING or RUNNING -> FAILED. PENDING covers a job that never launched.
     */
    public boolean fail(String taskId, String reason) {
        return transition(taskId, "fail", record -> {
            if (record.status != TaskStatus.RUNNING && record.status != TaskStatus.PENDING) {
                log.info("Ignoring failure of task {} in status {}: {}", taskId, record.status, reason);
                return false;
            }
            record.status = TaskStatus.FAILED;
            record.endTime = clock.instant();
            record.failureReason = reason;
            return true;
        });
    }

    /**
     * RUNNING -> STOPPING. Returns false, without side effects, for unknown
     * tasks and for tasks that are not RUNNING.
     */
    public boolean beginStop(String taskId) {
        return transition(taskId, "begin_stop", record -> {
            if (record.status != TaskStatus.RUNNING) {
                return false;
            }
            record.status = TaskStatus.STOPPING;
            return true;
        });
    }

    public boolean finalizeStop(String taskId) {
        return transition(taskId, "finalize_stop", record -> {
            if (record.status != TaskStatus.STOPPING) {
                log.warn("finalize_stop on task {} in status {}", taskId, record.status);
                return false;
            }
            record.status = TaskStatus.STOPPED;
            record.endTime = clock.instant();
            return true;
        });
    }

    /**
     * Add to the ingested item count. Allowed in every state: records that
     * reach the store after a stop are still counted.
     */
    public boolean recordItems(String taskId, int count) {
        return transition(taskId, "record_items", record -> {
            record.itemsCount += count;
            return true;
        });
    }

    public Optional<TaskView> get(String taskId) {
        TaskRecord record = tasks.get(taskId);
        return record == null ? Optional.empty() : Optional.of(record.snapshot());
    }

    /**
     * All tasks keyed by id, oldest first.
     */
    public Map<String, TaskView> listAll() {
        Map<String, TaskView> result = new LinkedHashMap<>();
        tasks.values().stream()
                .map(TaskRecord::snapshot)
                .sorted(Comparator.comparing(TaskView::startTime).thenComparing(TaskView::taskId))
                .forEach(view -> result.put(view.taskId(), view));
        return result;
    }

    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        tasks.values().forEach(record -> counts.merge(record.snapshot().status(), 1L, Long::sum));
        return counts;
    }

    /**
     * Drop terminal tasks that ended before the cutoff.
     */
    public int evictTerminatedBefore(Instant cutoff) {
        int evicted = 0;
        for (Map.Entry<String, TaskRecord> entry : tasks.entrySet()) {
            TaskRecord record = entry.getValue();
            boolean expired;
            synchronized (record) {
                expired = record.status.isTerminal()
                        && record.endTime != null
                        && record.endTime.isBefore(cutoff);
            }
            if (expired && tasks.remove(entry.getKey(), record)) {
                evicted++;
            }
        }
        return evicted;
    }

    public int size() {
        return tasks.size();
    }

    private boolean transition(String taskId, String operation, Predicate<TaskRecord> change) {
        TaskRecord record = tasks.get(taskId);
        if (record == null) {
            log.debug("{} on unknown task: taskId={}", operation, taskId);
            return false;
        }
        synchronized (record) {
            return change.test(record);
        }
    }

    /**
     * Mutable task state. Never leaves the registry; callers get {@link TaskView}s.
     */
    private static final class TaskRecord {
        private final String taskId;
        private final String spiderName;
        private final Map<String, Object> kwargs;
        private final Instant startTime;
        private TaskStatus status = TaskStatus.PENDING;
        private Instant endTime;
        private long itemsCount;
        private String failureReason;
        private Map<String, Object> result;

        private TaskRecord(String taskId, String spiderName, Map<String, Object> kwargs, Instant startTime) {
            this.taskId = taskId;
            this.spiderName = spiderName;
            this.kwargs = kwargs;
            this.startTime = startTime;
        }

        private synchronized TaskView snapshot() {
            return new TaskView(taskId, spiderName, kwargs, status, startTime, endTime,
                    itemsCount, failureReason, result);
        }
    }
}
