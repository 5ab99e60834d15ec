package com.scholary.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.config.OrchestratorProperties;
import com.scholary.orchestrator.job.FailureSummary;
import com.scholary.orchestrator.job.JobManager;
import com.scholary.orchestrator.job.JobNotFoundException;
import com.scholary.orchestrator.job.JobOptions;
import com.scholary.orchestrator.job.JobSnapshot;
import com.scholary.orchestrator.job.PipelineRegistry;
import com.scholary.orchestrator.task.TaskInput;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for batch jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a batch to a pipeline (returns job ID immediately)
 *   <li>Job status polling and cancellation
 *   <li>Retrying failed tasks, of one job or of the latest saved batch
 *   <li>Replaying the apply step over saved results
 *   <li>Reviewing the failures of the latest saved batch
 * </ul>
 */
@RestController
@Tag(name = "Jobs", description = "Batch job orchestration API")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final PipelineRegistry registry;
  private final ObjectMapper objectMapper;
  private final int defaultConcurrency;

  public JobController(
      PipelineRegistry registry, ObjectMapper objectMapper, OrchestratorProperties properties) {
    this.registry = registry;
    this.objectMapper = objectMapper;
    this.defaultConcurrency = properties.jobs().defaultConcurrency();
  }

  @GetMapping("/api/pipelines")
  @Operation(summary = "List pipelines", description = "Names of all registered pipelines")
  public List<String> pipelines() {
    return registry.names();
  }

  /** Start a job over a batch of tasks. */
  @PostMapping("/api/pipelines/{pipeline}/jobs")
  @Operation(
      summary = "Submit batch",
      description = "Start an asynchronous job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> submit(
      @PathVariable String pipeline, @Valid @RequestBody SubmitJobRequest request) {
    LOGGER.info("Submit request: pipeline={}, tasks={}", pipeline, request.tasks().size());
    JobManager<?, ?> manager = registry.manager(pipeline);
    String jobId =
        submit(
            manager,
            request.tasks(),
            options(request.concurrency(), request.priorityOrder(), request.dryRun()));
    return accepted(manager, jobId);
  }

  /**
   * Get job status.
   *
   * <p>Counters always satisfy completed = succeeded + failed; results grow as tasks finish.
   */
  @GetMapping("/api/jobs/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of a job")
  public JobStatusResponse status(@PathVariable String jobId) {
    return registry
        .findJob(jobId)
        .map(JobStatusResponse::from)
        .orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
  }

  @PostMapping("/api/jobs/{jobId}/retry-failed")
  @Operation(
      summary = "Retry failed tasks of a job",
      description = "Start a new job over the failed tasks of a finished job")
  public ResponseEntity<AsyncJobResponse> retryJobFailures(
      @PathVariable String jobId, @Valid @RequestBody(required = false) RetryRequest request) {
    JobManager<?, ?> manager = registry.managerForJob(jobId);
    return accepted(manager, manager.retryFailed(jobId, retryOptions(request)));
  }

  @PostMapping("/api/pipelines/{pipeline}/retry-failed")
  @Operation(
      summary = "Retry failed tasks of the latest batch",
      description = "Start a new job over the failed tasks of the latest saved batch")
  public ResponseEntity<AsyncJobResponse> retryLatestFailures(
      @PathVariable String pipeline, @Valid @RequestBody(required = false) RetryRequest request) {
    JobManager<?, ?> manager = registry.manager(pipeline);
    return accepted(manager, manager.retryFailedFromLatest(retryOptions(request)));
  }

  @PostMapping("/api/pipelines/{pipeline}/apply-saved")
  @Operation(
      summary = "Apply saved results",
      description = "Run the apply step over the successes of the latest saved batch")
  public ResponseEntity<AsyncJobResponse> applySaved(@PathVariable String pipeline) {
    JobManager<?, ?> manager = registry.manager(pipeline);
    return accepted(manager, manager.applySaved());
  }

  @PostMapping("/api/jobs/{jobId}/cancel")
  @Operation(summary = "Cancel job", description = "Stop a running job after its current tasks")
  public Map<String, Object> cancel(@PathVariable String jobId) {
    boolean cancelled = registry.managerForJob(jobId).cancel(jobId);
    return Map.of("jobId", jobId, "cancelled", cancelled);
  }

  @GetMapping("/api/pipelines/{pipeline}/results/latest/failures")
  @Operation(
      summary = "Failure summary",
      description = "Failed tasks of the latest saved batch with their errors")
  public FailureSummary failures(@PathVariable String pipeline) {
    return registry.manager(pipeline).failureSummary();
  }

  private <P> String submit(
      JobManager<P, ?> manager, List<TaskRequest> requests, JobOptions options) {
    List<TaskInput<P>> tasks =
        requests.stream()
            .map(
                task ->
                    new TaskInput<>(task.key(), task.priorityClass(), payload(manager, task)))
            .toList();
    return manager.submit(tasks, options);
  }

  private <P> P payload(JobManager<P, ?> manager, TaskRequest task) {
    try {
      return objectMapper.convertValue(task.payload(), manager.payloadType());
    } catch (IllegalArgumentException e) {
      throw new InvalidTaskPayloadException(
          "Invalid payload for task " + task.key() + ": " + e.getMessage(), e);
    }
  }

  private ResponseEntity<AsyncJobResponse> accepted(JobManager<?, ?> manager, String jobId) {
    JobSnapshot<?, ?> job = manager.require(jobId);
    LOGGER.info("Started job {} on pipeline {} with {} tasks", jobId, job.pipeline(), job.total());
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, job.pipeline(), job.total()));
  }

  private JobOptions retryOptions(RetryRequest request) {
    return request == null
        ? options(null, null, null)
        : options(request.concurrency(), request.priorityOrder(), request.dryRun());
  }

  private JobOptions options(Integer concurrency, List<String> priorityOrder, Boolean dryRun) {
    return new JobOptions(
        concurrency != null ? concurrency : defaultConcurrency,
        priorityOrder,
        Boolean.TRUE.equals(dryRun));
  }
}
