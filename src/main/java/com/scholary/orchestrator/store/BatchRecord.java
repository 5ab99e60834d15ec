package com.scholary.orchestrator.store;

import com.scholary.orchestrator.task.TaskOutcome;
import java.util.List;

/**
 * Persisted form of one completed run.
 *
 * @param timestamp UTC save time, {@code yyyyMMdd_HHmmss}
 * @param total number of outcomes
 * @param succeeded successful outcomes
 * @param failed failed outcomes
 * @param results outcomes in completion order
 */
public record BatchRecord<P, R>(
    String timestamp, int total, int succeeded, int failed, List<TaskOutcome<P, R>> results) {

  public BatchRecord {
    results = results == null ? List.of() : List.copyOf(results);
  }

  public static <P, R> BatchRecord<P, R> of(String timestamp, List<TaskOutcome<P, R>> outcomes) {
    int succeeded = (int) outcomes.stream().filter(TaskOutcome::success).count();
    return new BatchRecord<>(
        timestamp, outcomes.size(), succeeded, outcomes.size() - succeeded, outcomes);
  }
}
