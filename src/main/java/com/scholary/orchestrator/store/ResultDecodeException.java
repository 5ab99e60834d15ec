package com.scholary.orchestrator.store;

/**
 * Exception thrown when a stored batch record exists but cannot be decoded.
 *
 * <p>Kept apart from {@link RecordNotFoundException} so a corrupt file is never mistaken for an
 * empty history.
 */
public class ResultDecodeException extends ResultStoreException {

  public ResultDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
