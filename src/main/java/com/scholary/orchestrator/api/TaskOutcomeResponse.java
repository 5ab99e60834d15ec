package com.scholary.orchestrator.api;

import com.scholary.orchestrator.task.TaskOutcome;

/** One task's outcome as shown in job status. */
public record TaskOutcomeResponse(
    String key, String priorityClass, boolean success, String error, Object payload, int retries) {

  static TaskOutcomeResponse from(TaskOutcome<?, ?> outcome) {
    return new TaskOutcomeResponse(
        outcome.key(),
        outcome.input().priorityClass(),
        outcome.success(),
        outcome.error(),
        outcome.payload(),
        outcome.retries());
  }
}
