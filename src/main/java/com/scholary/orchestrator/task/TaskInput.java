package com.scholary.orchestrator.task;

import java.util.Objects;

/**
 * One unit of work in a batch.
 *
 * @param dedupKey identity used to drop duplicates within a batch
 * @param priorityClass label matched against the batch's priority order
 * @param payload pipeline-specific data handed to the executor
 */
public record TaskInput<P>(String dedupKey, String priorityClass, P payload) {

  public TaskInput {
    Objects.requireNonNull(dedupKey, "dedupKey");
  }
}
