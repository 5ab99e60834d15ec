package com.scholary.orchestrator.scheduler;

import com.scholary.orchestrator.task.TaskPrecondition;
import java.util.List;

/**
 * Settings for one scheduler run.
 *
 * @param concurrency maximum number of tasks executing at once
 * @param priorityOrder priority classes, most urgent first
 * @param precondition skip check applied before each task
 */
public record SchedulerOptions<P>(
    int concurrency, List<String> priorityOrder, TaskPrecondition<P> precondition) {

  public SchedulerOptions {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
    }
    priorityOrder = priorityOrder == null ? List.of() : List.copyOf(priorityOrder);
    precondition = precondition == null ? TaskPrecondition.always() : precondition;
  }

  public static <P> SchedulerOptions<P> of(int concurrency) {
    return new SchedulerOptions<>(concurrency, List.of(), TaskPrecondition.always());
  }
}
