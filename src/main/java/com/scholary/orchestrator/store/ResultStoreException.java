package com.scholary.orchestrator.store;

/**
 * Exception thrown when the result store cannot be read or written.
 *
 * <p>Subclasses tell a failed save, a missing record and an unreadable record apart.
 */
public class ResultStoreException extends RuntimeException {

  public ResultStoreException(String message) {
    super(message);
  }

  public ResultStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
