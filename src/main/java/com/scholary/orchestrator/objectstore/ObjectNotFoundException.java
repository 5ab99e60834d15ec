package com.scholary.orchestrator.objectstore;

/** Exception thrown when a requested object does not exist. */
public class ObjectNotFoundException extends ObjectStoreException {

  public ObjectNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
