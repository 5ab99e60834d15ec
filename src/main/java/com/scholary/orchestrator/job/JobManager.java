package com.scholary.orchestrator.job;

import com.scholary.orchestrator.logging.StructuredLogger;
import com.scholary.orchestrator.scheduler.Scheduler;
import com.scholary.orchestrator.scheduler.SchedulerOptions;
import com.scholary.orchestrator.scheduler.SubmissionPlanner;
import com.scholary.orchestrator.store.ResultStore;
import com.scholary.orchestrator.store.StoredBatch;
import com.scholary.orchestrator.task.TaskExecutor;
import com.scholary.orchestrator.task.TaskInput;
import com.scholary.orchestrator.task.TaskOutcome;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of the jobs of one pipeline.
 *
 * <p>Submitting plans the batch, registers a CREATED job and hands the run to the launcher
 * executor, returning the job id at once. The run then goes through these steps:
 *
 * <ol>
 *   <li>The pipeline builds its executor. If that fails the job goes from CREATED straight to
 *       FAILED and runs no task.
 *   <li>RUNNING; the scheduler runs the batch and each outcome updates the job's counters under
 *       its lock.
 *   <li>The pipeline's apply step, if any, runs over the successful outcomes, as a dry run when
 *       the job asks for one.
 *   <li>The outcomes are saved to the result store, unless there are none.
 *   <li>COMPLETED.
 * </ol>
 *
 * <p>Apply and save errors are recorded on the job without failing it, so a finished run is never
 * reported as lost.
 */
public class JobManager<P, R> {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobManager.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /** Alias accepted by {@link #retryFailed(String, JobOptions)} for the latest saved batch. */
  public static final String LATEST = "latest";

  private final Pipeline<P, R> pipeline;
  private final Scheduler scheduler;
  private final ResultStore<P, R> store;
  private final JobRepository repository;
  private final Executor launcher;

  public JobManager(
      Pipeline<P, R> pipeline,
      Scheduler scheduler,
      ResultStore<P, R> store,
      JobRepository repository,
      Executor launcher) {
    this.pipeline = pipeline;
    this.scheduler = scheduler;
    this.store = store;
    this.repository = repository;
    this.launcher = launcher;
  }

  public String pipelineName() {
    return pipeline.name();
  }

  public Class<P> payloadType() {
    return pipeline.payloadType();
  }

  public ResultStore<P, R> store() {
    return store;
  }

  /**
   * Start a job over a batch of tasks.
   *
   * @return the new job's id; the job runs in the background
   */
  public String submit(List<TaskInput<P>> tasks, JobOptions options) {
    return launchRun(JobKind.RUN, tasks, options);
  }

  public Optional<JobSnapshot<P, R>> status(String jobId) {
    return find(jobId).map(Job::snapshot);
  }

  /**
   * Current view of a job of this pipeline.
   *
   * @throws JobNotFoundException if the job is unknown here
   */
  public JobSnapshot<P, R> require(String jobId) {
    return status(jobId).orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
  }

  /**
   * Resubmit the failed tasks of a finished job.
   *
   * <p>Uses the job's saved record when there is one, its in-memory results otherwise. An
   * apply-saved job points at the record it replayed, so only its own outcomes count. {@value
   * #LATEST} stands for the latest saved batch.
   *
   * @throws JobNotFoundException if the job is unknown here
   * @throws JobNotFinishedException if the job has not finished yet
   */
  public String retryFailed(String jobId, JobOptions options) {
    if (LATEST.equals(jobId)) {
      return retryFailedFromLatest(options);
    }
    JobSnapshot<P, R> source = require(jobId);
    if (!source.status().isTerminal()) {
      throw new JobNotFinishedException("Job " + jobId + " has not finished yet");
    }

    List<TaskInput<P>> failedTasks;
    if (source.kind() != JobKind.APPLY_SAVED && source.recordId() != null) {
      failedTasks = store.load(source.recordId()).failedOnly().inputs();
    } else {
      failedTasks = source.failures().stream().map(TaskOutcome::input).toList();
    }
    LOGGER.info("Retrying {} failed tasks of job {}", failedTasks.size(), jobId);
    return launchRun(JobKind.RETRY_FAILED, failedTasks, options);
  }

  /**
   * Resubmit the failed tasks of the latest saved batch.
   *
   * @throws NoSavedResultsException if nothing has been saved yet
   */
  public String retryFailedFromLatest(JobOptions options) {
    StoredBatch<P, R> failed = store.loadFailedFromLatest().orElseThrow(this::noSavedResults);
    LOGGER.info(
        "Retrying {} failed tasks of record {}", failed.outcomes().size(), failed.recordId());
    return launchRun(JobKind.RETRY_FAILED, failed.inputs(), options);
  }

  /**
   * Run the apply step over the successful outcomes of the latest saved batch, without calling
   * the executor again.
   *
   * @throws ApplyStepUnavailableException if the pipeline has no apply step
   * @throws NoSavedResultsException if nothing has been saved yet
   */
  public String applySaved() {
    ApplyStep<P, R> applyStep =
        pipeline
            .applyStep()
            .orElseThrow(
                () ->
                    new ApplyStepUnavailableException(
                        "Pipeline " + pipeline.name() + " has no apply step"));
    StoredBatch<P, R> latest = store.loadLatest().orElseThrow(this::noSavedResults);
    List<TaskOutcome<P, R>> successes = latest.succeededOnly().outcomes();

    Job<P, R> job = register(JobKind.APPLY_SAVED, false, successes.size());
    LOGGER.info(
        "Applying {} saved results of record {} as job {}",
        successes.size(),
        latest.recordId(),
        job.id());
    launch(job, () -> runApplySaved(job, applyStep, successes, latest.recordId()));
    return job.id();
  }

  /**
   * Failed tasks of the latest saved batch.
   *
   * @throws NoSavedResultsException if nothing has been saved yet
   */
  public FailureSummary failureSummary() {
    StoredBatch<P, R> failed = store.loadFailedFromLatest().orElseThrow(this::noSavedResults);
    List<FailureSummary.Entry> entries =
        failed.outcomes().stream()
            .map(
                outcome ->
                    new FailureSummary.Entry(
                        outcome.key(), outcome.input().priorityClass(), outcome.error()))
            .toList();
    return new FailureSummary(failed.recordId(), failed.timestamp(), entries);
  }

  /**
   * Ask a job to stop. Tasks already running finish their current attempt; the rest are recorded
   * as cancelled.
   *
   * @return false if the job had already finished
   * @throws JobNotFoundException if the job is unknown here
   */
  public boolean cancel(String jobId) {
    Job<P, R> job =
        find(jobId).orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
    if (job.status().isTerminal()) {
      return false;
    }
    LOGGER.info("Cancelling job {}", jobId);
    job.cancellationToken().cancel();
    return true;
  }

  private String launchRun(JobKind kind, List<TaskInput<P>> tasks, JobOptions options) {
    List<TaskInput<P>> planned = SubmissionPlanner.plan(tasks, options.priorityOrder());
    Job<P, R> job = register(kind, options.dryRun(), planned.size());
    LOGGER.info(
        "Created {} job {}: pipeline={}, tasks={}, duplicates dropped={}, concurrency={}, dryRun={}",
        kind,
        job.id(),
        pipeline.name(),
        planned.size(),
        tasks.size() - planned.size(),
        options.concurrency(),
        options.dryRun());
    launch(job, () -> runJob(job, planned, options));
    return job.id();
  }

  private Job<P, R> register(JobKind kind, boolean dryRun, int total) {
    String jobId = pipeline.name() + "-" + UUID.randomUUID().toString().substring(0, 8);
    Job<P, R> job = new Job<>(jobId, pipeline.name(), kind, dryRun, total);
    repository.save(job);
    return job;
  }

  private void launch(Job<P, R> job, Runnable run) {
    try {
      launcher.execute(
          () -> {
            StructuredLogger.setJobContext(job.id(), pipeline.name());
            try {
              run.run();
            } finally {
              StructuredLogger.clearJobContext();
            }
          });
    } catch (RejectedExecutionException e) {
      LOGGER.error("Job launcher rejected job {}", job.id(), e);
      job.markFailed("Job launcher is saturated: " + e.getMessage());
    }
  }

  void runJob(Job<P, R> job, List<TaskInput<P>> planned, JobOptions options) {
    TaskExecutor<P, R> executor;
    try {
      executor = pipeline.createExecutor();
    } catch (RuntimeException e) {
      LOGGER.error("Job {} failed to start", job.id(), e);
      job.markFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
      return;
    }
    job.markRunning();

    boolean interrupted = false;
    String unfinishedReason = "Interrupted";
    try {
      scheduler.run(
          planned,
          executor,
          new SchedulerOptions<>(
              options.concurrency(), options.priorityOrder(), pipeline.precondition()),
          outcome -> onOutcome(job, outcome),
          job.cancellationToken());
    } catch (InterruptedException e) {
      LOGGER.warn("Job {} interrupted; recording unfinished tasks as failed", job.id());
      interrupted = true;
    } catch (RuntimeException e) {
      LOGGER.error("Scheduler failed for job {}", job.id(), e);
      unfinishedReason = "Unexpected error: " + e.getMessage();
    }
    job.failRemaining(planned, unfinishedReason);

    applyAndSave(job);
    job.markCompleted();
    logFinished(job);

    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void runApplySaved(
      Job<P, R> job, ApplyStep<P, R> applyStep, List<TaskOutcome<P, R>> successes, String recordId) {
    job.markRunning();
    apply(job, applyStep, successes, false);
    successes.forEach(job::record);
    job.recordSaved(recordId);
    job.markCompleted();
    logFinished(job);
  }

  private void onOutcome(Job<P, R> job, TaskOutcome<P, R> outcome) {
    job.record(outcome);
    JobSnapshot<P, R> snapshot = job.snapshot();
    structuredLogger.logJobProgress(
        job.id(), snapshot.completed(), snapshot.total(), snapshot.succeeded(), snapshot.failed());
  }

  private void applyAndSave(Job<P, R> job) {
    pipeline
        .applyStep()
        .ifPresent(step -> apply(job, step, job.successfulResults(), job.dryRun()));

    List<TaskOutcome<P, R>> results = job.results();
    if (results.isEmpty()) {
      LOGGER.info("Job {} has no outcomes; nothing to save", job.id());
      return;
    }
    try {
      job.recordSaved(store.save(results));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to save results of job {}", job.id(), e);
      job.recordSaveError("Save failed: " + e.getMessage());
    }
  }

  private void apply(
      Job<P, R> job, ApplyStep<P, R> step, List<TaskOutcome<P, R>> successes, boolean dryRun) {
    try {
      ApplyReport report = step.apply(successes, dryRun);
      job.recordApply(report);
      LOGGER.info(
          "Apply step finished for job {}: applied={}, skipped={}, dryRun={}",
          job.id(),
          report.applied(),
          report.skipped(),
          dryRun);
    } catch (Exception e) {
      LOGGER.error("Apply step failed for job {}", job.id(), e);
      job.recordApplyError("Apply failed: " + e.getMessage());
    }
  }

  private void logFinished(Job<P, R> job) {
    JobSnapshot<P, R> snapshot = job.snapshot();
    LOGGER.info(
        "Job {} completed: total={}, succeeded={}, failed={}, record={}",
        snapshot.id(),
        snapshot.total(),
        snapshot.succeeded(),
        snapshot.failed(),
        snapshot.recordId());
  }

  @SuppressWarnings("unchecked")
  private Optional<Job<P, R>> find(String jobId) {
    return repository
        .findById(jobId)
        .filter(job -> job.pipeline().equals(pipeline.name()))
        .map(job -> (Job<P, R>) job);
  }

  private NoSavedResultsException noSavedResults() {
    return new NoSavedResultsException("No saved results for pipeline " + pipeline.name());
  }
}
