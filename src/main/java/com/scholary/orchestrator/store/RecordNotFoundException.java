package com.scholary.orchestrator.store;

/** Exception thrown when no batch record exists under the requested id. */
public class RecordNotFoundException extends ResultStoreException {

  public RecordNotFoundException(String message) {
    super(message);
  }

  public RecordNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
