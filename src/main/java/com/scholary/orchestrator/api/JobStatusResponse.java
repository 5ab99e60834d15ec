package com.scholary.orchestrator.api;

import com.scholary.orchestrator.job.ApplyReport;
import com.scholary.orchestrator.job.JobKind;
import com.scholary.orchestrator.job.JobSnapshot;
import com.scholary.orchestrator.job.JobStatus;
import java.time.Instant;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>Shows the job's counters and every outcome collected so far, in completion order.
 */
public record JobStatusResponse(
    String jobId,
    String pipeline,
    JobKind kind,
    boolean dryRun,
    JobStatus status,
    int total,
    int completed,
    int succeeded,
    int failed,
    List<TaskOutcomeResponse> results,
    Instant startedAt,
    Instant completedAt,
    String error,
    String recordId,
    String saveError,
    ApplyReport applyReport,
    String applyError) {

  static JobStatusResponse from(JobSnapshot<?, ?> job) {
    return new JobStatusResponse(
        job.id(),
        job.pipeline(),
        job.kind(),
        job.dryRun(),
        job.status(),
        job.total(),
        job.completed(),
        job.succeeded(),
        job.failed(),
        job.results().stream().map(TaskOutcomeResponse::from).toList(),
        job.startedAt(),
        job.completedAt(),
        job.error(),
        job.recordId(),
        job.saveError(),
        job.applyReport(),
        job.applyError());
  }
}
