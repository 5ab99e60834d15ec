package com.scholary.orchestrator.store;

import com.scholary.orchestrator.task.TaskInput;
import com.scholary.orchestrator.task.TaskOutcome;
import java.util.List;

/**
 * A batch record read back from the store, together with its id.
 *
 * @param recordId store identifier
 * @param timestamp save time as written in the record
 * @param outcomes the record's outcomes, possibly filtered
 */
public record StoredBatch<P, R>(String recordId, String timestamp, List<TaskOutcome<P, R>> outcomes) {

  public StoredBatch {
    outcomes = List.copyOf(outcomes);
  }

  public StoredBatch<P, R> failedOnly() {
    return new StoredBatch<>(
        recordId, timestamp, outcomes.stream().filter(outcome -> !outcome.success()).toList());
  }

  public StoredBatch<P, R> succeededOnly() {
    return new StoredBatch<>(
        recordId, timestamp, outcomes.stream().filter(TaskOutcome::success).toList());
  }

  public List<TaskInput<P>> inputs() {
    return outcomes.stream().map(TaskOutcome::input).toList();
  }
}
