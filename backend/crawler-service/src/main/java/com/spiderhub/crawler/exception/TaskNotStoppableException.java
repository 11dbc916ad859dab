package com.spiderhub.crawler.exception;

import com.spiderhub.crawler.entity.TaskStatus;

/**
 * Stop was requested for a task that is not RUNNING.
 */
public class TaskNotStoppableException extends CrawlerException {

    private final String taskId;
    private final TaskStatus status;

    public TaskNotStoppableException(String taskId, TaskStatus status) {
        super("TASK_NOT_STOPPABLE",
                "Task " + taskId + " cannot be stopped in status " + status.toValue(),
                status.toValue(), null);
        this.taskId = taskId;
        this.status = status;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }
}
