package com.scholary.orchestrator.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>The SDK already retries transient failures; whatever reaches this exception is treated as
 * final by the caller.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
