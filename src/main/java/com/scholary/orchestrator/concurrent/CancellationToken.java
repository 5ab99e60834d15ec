package com.scholary.orchestrator.concurrent;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared by a job, its scheduler run and every retrying call made
 * on its behalf.
 *
 * <p>Cancellation is one-way: once {@link #cancel()} has been called the token stays cancelled.
 * Threads blocked in {@link #await(Duration)} wake up immediately when that happens, so backoff
 * sleeps and rate-limit waits end as soon as a job is cancelled.
 */
public final class CancellationToken {

  private final CountDownLatch cancelled = new CountDownLatch(1);

  /** A fresh token that nobody else holds, so it is never cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * Throw if the token has been cancelled.
   *
   * @throws CancellationException if cancelled
   */
  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new CancellationException("Operation cancelled");
    }
  }

  /**
   * Block for up to {@code duration} or until the token is cancelled.
   *
   * @return true if the token was cancelled while waiting
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(Duration duration) throws InterruptedException {
    if (duration.isNegative() || duration.isZero()) {
      return isCancelled();
    }
    return cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
  }
}
