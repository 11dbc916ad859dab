package com.spiderhub.crawler.service.runtime;

import com.spiderhub.crawler.exception.SpiderLaunchException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Execution engine seen from the orchestrator.
 *
 * launch() only submits the job; it never waits for the spider to run. Every
 * launched job resolves its handle's completion future exactly once.
 */
public interface JobRuntime {

    /**
     * Start a spider for an already registered task.
     *
     * @throws SpiderLaunchException if the spider cannot be instantiated
     */
    JobHandle launch(String spiderName, String taskId, Map<String, Object> kwargs);

    /**
     * Handle of a job that has not torn down yet.
     */
    Optional<JobHandle> findHandle(String taskId);

    /**
     * Ask the engine to tear the job down. The returned future resolves once
     * the job no longer produces items. Callers may time it out without
     * affecting the job.
     */
    CompletableFuture<Void> requestStop(JobHandle handle);

    Set<String> getSpiderNames();
}
