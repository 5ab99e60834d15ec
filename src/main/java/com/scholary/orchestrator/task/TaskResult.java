package com.scholary.orchestrator.task;

/**
 * Well-formed return value of a {@link TaskExecutor}.
 *
 * <p>A failure result is a task-level outcome, not an error to retry.
 */
public record TaskResult<R>(boolean success, R payload, String error) {

  public static <R> TaskResult<R> success(R payload) {
    return new TaskResult<>(true, payload, null);
  }

  public static <R> TaskResult<R> failure(String error) {
    return new TaskResult<>(false, null, error);
  }

  public static <R> TaskResult<R> failure(String error, R payload) {
    return new TaskResult<>(false, payload, error);
  }
}
