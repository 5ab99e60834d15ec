package com.scholary.orchestrator.retry;

import com.scholary.orchestrator.concurrent.CancellationToken;
import com.scholary.orchestrator.concurrent.Sleeper;
import com.scholary.orchestrator.logging.StructuredLogger;
import com.scholary.orchestrator.ratelimit.RateLimiter;
import com.scholary.orchestrator.retry.RetryFailedException.Reason;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs calls against a flaky remote dependency with rate limiting and exponential backoff.
 *
 * <p>Every attempt first takes a slot from the shared {@link RateLimiter}. Transient failures are
 * retried after {@code min(base * 2^n, maxDelay)} plus jitter, or after the server's own hint when
 * the error carries one. Non-retryable errors fail fast.
 *
 * <p>Thread safe: one executor is shared by all workers of a pipeline.
 */
public class RetryExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final RetryPolicy policy;
  private final RateLimiter rateLimiter;
  private final RetryableErrorClassifier classifier;
  private final Sleeper sleeper;
  private final DoubleSupplier random;

  public RetryExecutor(RetryPolicy policy, RateLimiter rateLimiter) {
    this(
        policy,
        rateLimiter,
        new RetryableErrorClassifier(),
        Sleeper.system(),
        () -> ThreadLocalRandom.current().nextDouble());
  }

  public RetryExecutor(
      RetryPolicy policy,
      RateLimiter rateLimiter,
      RetryableErrorClassifier classifier,
      Sleeper sleeper,
      DoubleSupplier random) {
    this.policy = policy;
    this.rateLimiter = rateLimiter;
    this.classifier = classifier;
    this.sleeper = sleeper;
    this.random = random;
  }

  /**
   * Call with retries.
   *
   * @param call the remote operation
   * @param token cancellation token checked before each attempt and while waiting
   * @return the result together with the number of retries it took
   * @throws RetryFailedException when the call is given up (see {@link Reason})
   * @throws InterruptedException if the calling thread is interrupted
   */
  public <T> Attempt<T> call(Callable<T> call, CancellationToken token)
      throws InterruptedException {
    Exception lastError = null;
    int attempts = 0;

    while (attempts < policy.maxRetries()) {
      try {
        token.throwIfCancelled();
        rateLimiter.acquire(token);
      } catch (CancellationException e) {
        throw new RetryFailedException(Reason.CANCELLED, attempts, lastError);
      }

      attempts++;
      try {
        return new Attempt<>(call.call(), attempts - 1);
      } catch (InterruptedException e) {
        throw e;
      } catch (Exception e) {
        lastError = e;
        if (!classifier.isRetryable(e)) {
          giveUp(Reason.NON_RETRYABLE, attempts, e);
        }
        if (attempts >= policy.maxRetries()) {
          giveUp(Reason.RETRIES_EXHAUSTED, attempts, e);
        }

        Optional<Duration> hint = RetryHints.extract(e);
        Duration delay = policy.delayFor(attempts - 1, hint, random.getAsDouble());
        structuredLogger.logRetry(
            attempts,
            policy.maxRetries(),
            delay.toMillis(),
            hint.isPresent(),
            e.getClass().getSimpleName(),
            e.getMessage());
        sleeper.sleep(delay, token);
      }
    }
    throw new RetryFailedException(Reason.RETRIES_EXHAUSTED, attempts, lastError);
  }

  public RetryPolicy policy() {
    return policy;
  }

  public RateLimiter rateLimiter() {
    return rateLimiter;
  }

  private void giveUp(Reason reason, int attempts, Exception error) {
    structuredLogger.logCallFailed(
        reason.description(), attempts, error.getClass().getSimpleName(), error.getMessage());
    throw new RetryFailedException(reason, attempts, error);
  }
}
