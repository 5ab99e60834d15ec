package com.scholary.orchestrator.api;

/** Exception thrown when a task payload cannot be read as the pipeline's payload type. */
public class InvalidTaskPayloadException extends RuntimeException {

  public InvalidTaskPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
