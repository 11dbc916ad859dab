package com.spiderhub.crawler.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a spider task.
 */
public enum TaskStatus {
    /**
     * Task record allocated, job not yet acknowledged by the runtime
     */
    PENDING,

    /**
     * Job is executing inside the crawl engine
     */
    RUNNING,

    /**
     * Stop requested, waiting for the engine to tear the job down
     */
    STOPPING,

    /**
     * Job finished on its own
     */
    COMPLETED,

    /**
     * Job failed to launch or raised an error while running
     */
    FAILED,

    /**
     * Job was stopped on request
     */
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
