package com.scholary.orchestrator.task;

import java.util.Optional;

/**
 * Check run before a task executes.
 *
 * <p>A task whose precondition reports a reason is recorded as failed with that reason and never
 * reaches the executor.
 */
@FunctionalInterface
public interface TaskPrecondition<P> {

  /** Reason the task cannot run, or empty if it can. */
  Optional<String> unresolved(TaskInput<P> input);

  static <P> TaskPrecondition<P> always() {
    return input -> Optional.empty();
  }
}
