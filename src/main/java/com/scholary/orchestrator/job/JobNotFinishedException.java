package com.scholary.orchestrator.job;

/** Exception thrown when an operation needs a finished job but the job is still queued or running. */
public class JobNotFinishedException extends RuntimeException {

  public JobNotFinishedException(String message) {
    super(message);
  }
}
