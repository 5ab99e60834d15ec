package com.scholary.orchestrator.job;

import com.scholary.orchestrator.concurrent.CancellationToken;
import com.scholary.orchestrator.task.TaskInput;
import com.scholary.orchestrator.task.TaskOutcome;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one job.
 *
 * <p>Only {@link JobManager} changes a job, and every change happens under the job's monitor.
 * Readers go through {@link #snapshot()}.
 */
final class Job<P, R> {

  private final String id;
  private final String pipeline;
  private final JobKind kind;
  private final boolean dryRun;
  private final int total;
  private final Instant createdAt;
  private final CancellationToken cancellationToken = new CancellationToken();

  private JobStatus status = JobStatus.CREATED;
  private int completed;
  private int succeeded;
  private int failed;
  private final List<TaskOutcome<P, R>> results = new ArrayList<>();
  private final Set<String> finishedKeys = new HashSet<>();
  private Instant startedAt;
  private Instant completedAt;
  private String error;
  private String recordId;
  private String saveError;
  private ApplyReport applyReport;
  private String applyError;

  Job(String id, String pipeline, JobKind kind, boolean dryRun, int total) {
    this.id = id;
    this.pipeline = pipeline;
    this.kind = kind;
    this.dryRun = dryRun;
    this.total = total;
    this.createdAt = Instant.now();
  }

  String id() {
    return id;
  }

  String pipeline() {
    return pipeline;
  }

  boolean dryRun() {
    return dryRun;
  }

  CancellationToken cancellationToken() {
    return cancellationToken;
  }

  synchronized JobStatus status() {
    return status;
  }

  synchronized void markRunning() {
    requireStatus(JobStatus.CREATED);
    status = JobStatus.RUNNING;
    startedAt = Instant.now();
  }

  synchronized void record(TaskOutcome<P, R> outcome) {
    requireStatus(JobStatus.RUNNING);
    if (completed >= total) {
      throw new IllegalStateException("Job " + id + " already has all " + total + " outcomes");
    }
    results.add(outcome);
    finishedKeys.add(outcome.key());
    completed++;
    if (outcome.success()) {
      succeeded++;
    } else {
      failed++;
    }
  }

  /** Record a failed outcome for every planned task that has none yet. */
  synchronized void failRemaining(List<TaskInput<P>> planned, String reason) {
    for (TaskInput<P> task : planned) {
      if (completed >= total) {
        return;
      }
      if (!finishedKeys.contains(task.dedupKey())) {
        record(TaskOutcome.failed(task, reason, 0));
      }
    }
  }

  synchronized void recordApply(ApplyReport report) {
    this.applyReport = report;
  }

  synchronized void recordApplyError(String message) {
    this.applyError = message;
  }

  synchronized void recordSaved(String recordId) {
    this.recordId = recordId;
  }

  synchronized void recordSaveError(String message) {
    this.saveError = message;
  }

  synchronized void markCompleted() {
    requireStatus(JobStatus.RUNNING);
    status = JobStatus.COMPLETED;
    completedAt = Instant.now();
  }

  synchronized void markFailed(String message) {
    if (status.isTerminal()) {
      throw new IllegalStateException("Job " + id + " is already " + status);
    }
    status = JobStatus.FAILED;
    error = message;
    completedAt = Instant.now();
  }

  synchronized List<TaskOutcome<P, R>> results() {
    return List.copyOf(results);
  }

  synchronized List<TaskOutcome<P, R>> successfulResults() {
    return results.stream().filter(TaskOutcome::success).toList();
  }

  synchronized JobSnapshot<P, R> snapshot() {
    return new JobSnapshot<>(
        id,
        pipeline,
        kind,
        dryRun,
        status,
        total,
        completed,
        succeeded,
        failed,
        results,
        createdAt,
        startedAt,
        completedAt,
        error,
        recordId,
        saveError,
        applyReport,
        applyError);
  }

  private void requireStatus(JobStatus expected) {
    if (status != expected) {
      throw new IllegalStateException(
          "Job " + id + " is " + status + ", expected " + expected);
    }
  }
}
