package com.scholary.orchestrator.concurrent;

import java.time.Duration;

/**
 * Blocking pause used by the rate limiter and the retry executor.
 *
 * <p>Tests replace the system sleeper with one that records the requested durations and advances a
 * fake clock instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Pause the calling thread.
   *
   * @param duration how long to pause
   * @param token cancellation token; a cancelled token ends the pause early
   * @throws InterruptedException if the thread is interrupted while paused
   */
  void sleep(Duration duration, CancellationToken token) throws InterruptedException;

  /** Sleeper backed by the token's latch, so cancellation wakes it up. */
  static Sleeper system() {
    return (duration, token) -> token.await(duration);
  }
}
