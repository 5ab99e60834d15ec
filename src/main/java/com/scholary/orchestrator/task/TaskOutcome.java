package com.scholary.orchestrator.task;

/**
 * Final, immutable result of one task in a run.
 *
 * @param input the task that ran
 * @param success whether it succeeded
 * @param error failure description, null on success
 * @param payload the executor's payload, if any
 * @param retries retries performed before the final attempt
 */
public record TaskOutcome<P, R>(
    TaskInput<P> input, boolean success, String error, R payload, int retries) {

  public static <P, R> TaskOutcome<P, R> succeeded(TaskInput<P> input, R payload, int retries) {
    return new TaskOutcome<>(input, true, null, payload, retries);
  }

  public static <P, R> TaskOutcome<P, R> failed(TaskInput<P> input, String error, int retries) {
    return new TaskOutcome<>(input, false, error, null, retries);
  }

  public static <P, R> TaskOutcome<P, R> from(
      TaskInput<P> input, TaskResult<R> result, int retries) {
    return new TaskOutcome<>(
        input, result.success(), result.success() ? null : result.error(), result.payload(), retries);
  }

  public String key() {
    return input.dedupKey();
  }
}
