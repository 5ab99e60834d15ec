package com.scholary.orchestrator.store;

/** Exception thrown when a batch record could not be persisted. */
public class ResultSaveException extends ResultStoreException {

  public ResultSaveException(String message) {
    super(message);
  }

  public ResultSaveException(String message, Throwable cause) {
    super(message, cause);
  }
}
