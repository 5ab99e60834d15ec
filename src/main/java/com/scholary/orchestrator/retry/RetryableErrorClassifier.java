package com.scholary.orchestrator.retry;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a failed call is worth retrying.
 *
 * <p>Throttling (429), server errors (500, 502, 503, 504) and network-level timeouts or connection
 * failures are transient. JSON decode errors and anything unrecognised fail fast: retrying a
 * malformed request or an unparseable reply just burns quota.
 */
public class RetryableErrorClassifier {

  static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

  private static final Pattern STATUS_CODE_IN_TEXT = Pattern.compile("\\b(429|500|502|503|504)\\b");

  private static final List<String> TRANSIENT_KEYWORDS =
      List.of(
          "rate limit",
          "quota",
          "timeout",
          "timed out",
          "connection",
          "network",
          "unavailable",
          "bad gateway",
          "gateway timeout",
          "internal server error");

  /**
   * Classify an error, following its cause chain.
   *
   * @param error the error raised by the call
   * @return true if another attempt may succeed
   */
  public boolean isRetryable(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof JsonProcessingException) {
        return false;
      }
      if (t instanceof RemoteCallException remote) {
        return RETRYABLE_STATUS_CODES.contains(remote.statusCode());
      }
      if (t instanceof HttpTimeoutException
          || t instanceof ConnectException
          || t instanceof SocketTimeoutException) {
        return true;
      }
      if (looksTransient(t.getMessage())) {
        return true;
      }
    }
    return false;
  }

  private boolean looksTransient(String message) {
    if (message == null || message.isBlank()) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String keyword : TRANSIENT_KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return STATUS_CODE_IN_TEXT.matcher(lower).find();
  }
}
