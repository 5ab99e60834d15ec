package com.scholary.orchestrator.retry;

/**
 * Exception thrown when the retry executor gives up on a call.
 *
 * <p>The {@link Reason} tells whether the call ran out of attempts, hit an error that is not worth
 * retrying, or was cancelled. The last underlying error is kept as the cause.
 */
public class RetryFailedException extends RuntimeException {

  public enum Reason {
    RETRIES_EXHAUSTED("retries exhausted"),
    NON_RETRYABLE("non-retryable error"),
    CANCELLED("cancelled");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  private final Reason reason;
  private final int attempts;

  public RetryFailedException(Reason reason, int attempts, Throwable cause) {
    super(buildMessage(reason, attempts, cause), cause);
    this.reason = reason;
    this.attempts = attempts;
  }

  public Reason reason() {
    return reason;
  }

  /** Number of attempts that actually reached the remote dependency. */
  public int attempts() {
    return attempts;
  }

  private static String buildMessage(Reason reason, int attempts, Throwable cause) {
    String base =
        String.format("Call failed (%s) after %d attempt(s)", reason.description(), attempts);
    if (cause == null) {
      return base;
    }
    return base + ": " + describe(cause);
  }

  static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank()
        ? error.getClass().getSimpleName()
        : error.getClass().getSimpleName() + ": " + message;
  }
}
