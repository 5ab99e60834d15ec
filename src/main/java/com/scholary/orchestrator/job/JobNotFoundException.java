package com.scholary.orchestrator.job;

/**
 * Exception thrown when a job id is unknown, expired, or belongs to another pipeline.
 */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String message) {
    super(message);
  }

  public JobNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
