package com.spiderhub.crawler.service;

import com.spiderhub.crawler.dto.TaskStatsResponse;
import com.spiderhub.crawler.dto.TaskView;
import com.spiderhub.crawler.entity.TaskStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class TaskStatsService {

    static final int RECENT_TASK_LIMIT = 10;

    private final TaskRegistry taskRegistry;

    public TaskStatsResponse getStats() {
        Collection<TaskView> tasks = taskRegistry.listAll().values();

        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            breakdown.put(status.toValue(), 0L);
        }
        long totalItems = 0;
        for (TaskView task : tasks) {
            breakdown.merge(task.status().toValue(), 1L, Long::sum);
            totalItems += task.itemsCount();
        }

        List<TaskView> recent = tasks.stream()
                .sorted(Comparator.comparing(TaskView::startTime).reversed())
                .limit(RECENT_TASK_LIMIT)
                .toList();

        TaskStatsResponse.Overview overview = new TaskStatsResponse.Overview(
                tasks.size(),
                totalItems,
                successRate(breakdown.get(TaskStatus.COMPLETED.toValue()), breakdown.get(TaskStatus.FAILED.toValue())));

        return new TaskStatsResponse(overview, breakdown, recent);
    }

    /**
     * completed / (completed + failed) as a percentage, two decimals. 0 when
     * nothing has finished yet.
     */
    static double successRate(long completed, long failed) {
        long finished = completed + failed;
        if (finished == 0) {
            return 0.0;
        }
        return Math.round(completed * 10_000.0 / finished) / 100.0;
    }
}
