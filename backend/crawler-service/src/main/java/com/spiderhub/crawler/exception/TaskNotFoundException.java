package com.spiderhub.crawler.exception;

/**
 * 존재하지 않는 작업 ID
 */
public class TaskNotFoundException extends CrawlerException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("TASK_NOT_FOUND", "Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
