package com.scholary.orchestrator.task;

/**
 * Caller-supplied work performed for one task.
 *
 * <p>Implementations are invoked concurrently from several worker threads and must be safe for
 * that. Throwing marks the attempt as failed; whether it is retried depends on the error. Returning
 * {@link TaskResult#failure(String)} ends the task without retries.
 */
@FunctionalInterface
public interface TaskExecutor<P, R> {

  TaskResult<R> execute(TaskInput<P> input) throws Exception;
}
