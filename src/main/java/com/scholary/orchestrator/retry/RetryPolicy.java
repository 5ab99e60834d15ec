package com.scholary.orchestrator.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * Backoff settings for the retry executor.
 *
 * <p>{@code maxRetries} is the total number of attempts a call gets, including the first one.
 *
 * @param maxRetries maximum attempts per call
 * @param baseDelay delay before the first retry
 * @param maxDelay upper bound for computed and hinted delays
 * @param jitterRatio fraction of the exponential delay added as random jitter (0.3 = up to 30%)
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitterRatio) {

  private static final Duration HINT_MARGIN = Duration.ofSeconds(1);

  public RetryPolicy {
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
    }
    if (baseDelay == null || baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be at least baseDelay");
    }
    if (jitterRatio < 0) {
      throw new IllegalArgumentException("jitterRatio must not be negative: " + jitterRatio);
    }
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.3);
  }

  /**
   * Delay before the next attempt.
   *
   * <p>A server hint wins over the exponential schedule: the hint plus one second, capped at
   * {@code maxDelay}, without jitter. Otherwise {@code min(baseDelay * 2^retryIndex, maxDelay)}
   * plus {@code jitter * jitterRatio} of that value.
   *
   * @param retryIndex zero-based index of the retry about to happen
   * @param hint server-provided delay, if any
   * @param jitter random value in [0, 1)
   */
  public Duration delayFor(int retryIndex, Optional<Duration> hint, double jitter) {
    if (hint.isPresent()) {
      return min(hint.get().plus(HINT_MARGIN), maxDelay);
    }
    Duration exponential = min(baseDelay.multipliedBy(1L << Math.min(retryIndex, 30)), maxDelay);
    long jitterMillis = Math.round(exponential.toMillis() * jitterRatio * jitter);
    return exponential.plusMillis(jitterMillis);
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }
}
