package com.scholary.orchestrator.job;

/**
 * Lifecycle of a job.
 *
 * <p>{@code FAILED} means the job never ran its tasks; a job whose tasks failed is still {@code
 * COMPLETED}.
 */
public enum JobStatus {
  CREATED,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
