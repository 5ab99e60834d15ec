package com.scholary.orchestrator.job;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Job managers of all registered pipelines, by pipeline name. */
public class PipelineRegistry {

  private final Map<String, JobManager<?, ?>> managers = new LinkedHashMap<>();
  private final JobRepository repository;

  public PipelineRegistry(List<JobManager<?, ?>> managers, JobRepository repository) {
    for (JobManager<?, ?> manager : managers) {
      if (this.managers.putIfAbsent(manager.pipelineName(), manager) != null) {
        throw new IllegalStateException("Duplicate pipeline name: " + manager.pipelineName());
      }
    }
    this.repository = repository;
  }

  public List<String> names() {
    return List.copyOf(managers.keySet());
  }

  /**
   * Manager of a pipeline.
   *
   * @throws PipelineNotFoundException if no pipeline has that name
   */
  public JobManager<?, ?> manager(String pipeline) {
    JobManager<?, ?> manager = managers.get(pipeline);
    if (manager == null) {
      throw new PipelineNotFoundException("Pipeline not found: " + pipeline);
    }
    return manager;
  }

  public Optional<JobSnapshot<?, ?>> findJob(String jobId) {
    return repository.findSnapshot(jobId);
  }

  /**
   * Manager of the pipeline that owns a job.
   *
   * @throws JobNotFoundException if the job is unknown
   */
  public JobManager<?, ?> managerForJob(String jobId) {
    JobSnapshot<?, ?> job =
        findJob(jobId).orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
    return manager(job.pipeline());
  }
}
