package com.scholary.orchestrator.retry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts server-provided retry delays from errors.
 *
 * <p>Remote APIs announce how long a client should back off in different ways: a {@code
 * Retry-After} header (surfaced through {@link RemoteCallException#retryAfter()}), prose such as
 * "Please retry in 5.2s" or "retry after 30", or JSON fields like {@code "retryDelay": "5s"} and
 * {@code "retry_after": 5} embedded in the error body.
 */
public final class RetryHints {

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile(
              "retry[_\\s-]*(?:after|in)[:\\s]+(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "\"retry_?delay\"\\s*:\\s*\"?(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "\"retry_?after\"\\s*:\\s*\"?(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE));

  private RetryHints() {}

  /**
   * Find a retry hint anywhere in the cause chain.
   *
   * @param error the failed call's error
   * @return the hinted delay, or empty if the error carries none
   */
  public static Optional<Duration> extract(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof RemoteCallException remote && remote.retryAfter().isPresent()) {
        return remote.retryAfter();
      }
      Optional<Duration> fromMessage = parse(t.getMessage());
      if (fromMessage.isPresent()) {
        return fromMessage;
      }
    }
    return Optional.empty();
  }

  /** Parse a retry hint from free text. */
  public static Optional<Duration> parse(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    for (Pattern pattern : PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      if (matcher.find()) {
        double seconds = Double.parseDouble(matcher.group(1));
        return Optional.of(Duration.ofMillis(Math.round(seconds * 1000)));
      }
    }
    return Optional.empty();
  }
}
