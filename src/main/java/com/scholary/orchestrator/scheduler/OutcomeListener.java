package com.scholary.orchestrator.scheduler;

import com.scholary.orchestrator.task.TaskOutcome;

/** Receives outcomes one at a time, in completion order, on the thread that runs the batch. */
@FunctionalInterface
public interface OutcomeListener<P, R> {

  void onOutcome(TaskOutcome<P, R> outcome);

  static <P, R> OutcomeListener<P, R> ignoring() {
    return outcome -> {};
  }
}
