package com.scholary.orchestrator.job;

/**
 * Exception thrown when no pipeline is registered under a name.
 */
public class PipelineNotFoundException extends RuntimeException {

  public PipelineNotFoundException(String message) {
    super(message);
  }

  public PipelineNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
