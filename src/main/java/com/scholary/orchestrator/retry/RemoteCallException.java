package com.scholary.orchestrator.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Exception thrown when a remote dependency answers with an error status.
 *
 * <p>Carries the HTTP-style status code so the retry classifier can tell throttling and server
 * errors apart from client errors, plus the server's {@code Retry-After} hint when one was sent.
 */
public class RemoteCallException extends RuntimeException {

  private final int statusCode;
  private final Duration retryAfter;

  public RemoteCallException(int statusCode, String message) {
    this(statusCode, message, null);
  }

  public RemoteCallException(int statusCode, String message, Duration retryAfter) {
    super(message);
    this.statusCode = statusCode;
    this.retryAfter = retryAfter;
  }

  public int statusCode() {
    return statusCode;
  }

  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
