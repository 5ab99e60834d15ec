package com.scholary.orchestrator.job;

import com.scholary.orchestrator.task.TaskOutcome;
import java.time.Instant;
import java.util.List;

/**
 * Consistent, immutable view of a job at one moment.
 *
 * <p>Counters and results are copied under the job's lock, so {@code completed == succeeded +
 * failed} and {@code completed <= total} hold in every snapshot.
 */
public record JobSnapshot<P, R>(
    String id,
    String pipeline,
    JobKind kind,
    boolean dryRun,
    JobStatus status,
    int total,
    int completed,
    int succeeded,
    int failed,
    List<TaskOutcome<P, R>> results,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String error,
    String recordId,
    String saveError,
    ApplyReport applyReport,
    String applyError) {

  public JobSnapshot {
    results = List.copyOf(results);
  }

  public List<TaskOutcome<P, R>> failures() {
    return results.stream().filter(outcome -> !outcome.success()).toList();
  }
}
