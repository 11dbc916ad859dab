package com.spiderhub.crawler.service.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * 실행 중인 작업에 대한 불투명 핸들.
 * 완료(성공/실패) 신호는 한 번만 발생한다.
 */
public interface JobHandle {

    String getTaskId();

    String getSpiderName();

    /**
     * One-shot terminal signal. Completes normally with the job summary or
     * exceptionally with the job's failure.
     */
    CompletableFuture<JobResult> completion();

    default void onComplete(Consumer<JobResult> callback, Executor executor) {
        completion().thenAcceptAsync(callback, executor);
    }

    default void onFail(Consumer<Throwable> callback, Executor executor) {
        completion().whenCompleteAsync((result, error) -> {
            if (error != null) {
                callback.accept(unwrap(error));
            }
        }, executor);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
