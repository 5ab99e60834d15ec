package com.scholary.orchestrator.job;

/**
 * Exception thrown when an operation needs a saved batch and the store holds none.
 */
public class NoSavedResultsException extends RuntimeException {

  public NoSavedResultsException(String message) {
    super(message);
  }

  public NoSavedResultsException(String message, Throwable cause) {
    super(message, cause);
  }
}
