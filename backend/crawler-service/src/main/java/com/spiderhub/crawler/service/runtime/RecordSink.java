package com.spiderhub.crawler.service.runtime;

import java.util.List;
import java.util.Map;

/**
 * Destination of the records a job produces. Called off the engine thread,
 * one batch at a time per task, in production order.
 */
@FunctionalInterface
public interface RecordSink {

    void deliver(String taskId, List<Map<String, Object>> records);
}
