package com.scholary.orchestrator.job;

/**
 * Exception thrown when a pipeline cannot set up the collaborators a job needs.
 *
 * <p>The job is marked FAILED without running any task.
 */
public class PipelineInitializationException extends RuntimeException {

  public PipelineInitializationException(String message) {
    super(message);
  }

  public PipelineInitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
