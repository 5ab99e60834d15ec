package com.scholary.orchestrator.ratelimit;

import com.scholary.orchestrator.concurrent.CancellationToken;
import com.scholary.orchestrator.concurrent.Sleeper;
import com.scholary.orchestrator.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-window admission control in front of one remote dependency.
 *
 * <p>Keeps the instants of recently admitted calls. A call is admitted only while fewer than
 * {@code maxCalls} admissions fall inside the trailing window; otherwise the caller waits until the
 * oldest admission leaves the window and checks again.
 *
 * <p>One instance is shared by all workers talking to the same client. The window is guarded by a
 * single lock that is never held while a caller waits.
 */
public class RateLimiter {

  private static final Logger LOGGER = LoggerFactory.getLogger(RateLimiter.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final int maxCalls;
  private final Duration window;
  private final Clock clock;
  private final Sleeper sleeper;

  private final Deque<Instant> admitted = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();

  public RateLimiter(int maxCalls, Duration window) {
    this(maxCalls, window, Clock.systemUTC(), Sleeper.system());
  }

  public RateLimiter(int maxCalls, Duration window, Clock clock, Sleeper sleeper) {
    if (maxCalls < 1) {
      throw new IllegalArgumentException("maxCalls must be positive: " + maxCalls);
    }
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive: " + window);
    }
    this.maxCalls = maxCalls;
    this.window = window;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * Block until one more call can be admitted.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void acquire() throws InterruptedException {
    acquire(CancellationToken.none());
  }

  /**
   * Block until one more call can be admitted or the token is cancelled.
   *
   * @throws InterruptedException if interrupted while waiting
   * @throws CancellationException if the token is cancelled while waiting
   */
  public void acquire(CancellationToken token) throws InterruptedException {
    while (true) {
      Duration wait;
      lock.lock();
      try {
        Instant now = clock.instant();
        evictExpired(now);
        if (admitted.size() < maxCalls) {
          admitted.addLast(now);
          return;
        }
        wait = window.minus(Duration.between(admitted.peekFirst(), now));
      } finally {
        lock.unlock();
      }

      if (wait.isNegative() || wait.isZero()) {
        continue;
      }
      structuredLogger.logRateLimited(maxCalls, window.toMillis(), wait.toMillis());
      sleeper.sleep(wait, token);
      if (token.isCancelled()) {
        throw new CancellationException("Rate limiter wait cancelled");
      }
    }
  }

  /** Number of admissions currently inside the window. */
  public int admittedInWindow() {
    lock.lock();
    try {
      evictExpired(clock.instant());
      return admitted.size();
    } finally {
      lock.unlock();
    }
  }

  public int maxCalls() {
    return maxCalls;
  }

  public Duration window() {
    return window;
  }

  // Caller holds the lock.
  private void evictExpired(Instant now) {
    Instant cutoff = now.minus(window);
    while (!admitted.isEmpty() && !admitted.peekFirst().isAfter(cutoff)) {
      admitted.removeFirst();
    }
  }
}
