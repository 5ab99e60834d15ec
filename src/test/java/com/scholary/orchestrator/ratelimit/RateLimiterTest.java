package com.scholary.orchestrator.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.orchestrator.concurrent.CancellationToken;
import com.scholary.orchestrator.concurrent.MutableClock;
import com.scholary.orchestrator.concurrent.RecordingSleeper;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RateLimiterTest {

  private static final Instant START = Instant.parse("2026-10-19T12:00:00Z");

  @Test
  void acquire_shouldAdmitUpToLimitWithoutWaiting() throws Exception {
    MutableClock clock = new MutableClock(START);
    RecordingSleeper sleeper = new RecordingSleeper(clock);
    RateLimiter limiter = new RateLimiter(3, Duration.ofSeconds(60), clock, sleeper);

    limiter.acquire();
    limiter.acquire();
    limiter.acquire();

    assertThat(sleeper.sleeps()).isEmpty();
    assertThat(limiter.admittedInWindow()).isEqualTo(3);
  }

  @Test
  void acquire_shouldWaitUntilOldestAdmissionLeavesWindow() throws Exception {
    MutableClock clock = new MutableClock(START);
    RecordingSleeper sleeper = new RecordingSleeper(clock);
    RateLimiter limiter = new RateLimiter(2, Duration.ofSeconds(60), clock, sleeper);

    limiter.acquire();
    clock.advance(Duration.ofSeconds(10));
    limiter.acquire();
    clock.advance(Duration.ofSeconds(5));

    limiter.acquire();

    // Oldest admission at t=0, now t=15: 45s until it leaves the window
    assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(45));
    assertThat(clock.instant()).isEqualTo(START.plusSeconds(60));
    assertThat(limiter.admittedInWindow()).isEqualTo(2);
  }

  @Test
  void acquire_shouldForgetAdmissionsOlderThanWindow() throws Exception {
    MutableClock clock = new MutableClock(START);
    RecordingSleeper sleeper = new RecordingSleeper(clock);
    RateLimiter limiter = new RateLimiter(1, Duration.ofSeconds(1), clock, sleeper);

    limiter.acquire();
    clock.advance(Duration.ofSeconds(1));
    limiter.acquire();

    assertThat(sleeper.sleeps()).isEmpty();
  }

  @Test
  void acquire_shouldNeverAdmitMoreThanLimitInAnyWindowUnderConcurrency() throws Exception {
    int maxCalls = 3;
    Duration window = Duration.ofMillis(300);
    RateLimiter limiter = new RateLimiter(maxCalls, window);
    List<Long> admittedAt = Collections.synchronizedList(new ArrayList<>());

    int callers = 6;
    int callsEach = 2;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < callers; i++) {
      futures.add(
          pool.submit(
              () -> {
                start.await();
                for (int c = 0; c < callsEach; c++) {
                  limiter.acquire();
                  admittedAt.add(System.nanoTime());
                }
                return null;
              }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }
    pool.shutdown();

    List<Long> sorted = new ArrayList<>(admittedAt);
    Collections.sort(sorted);
    assertThat(sorted).hasSize(callers * callsEach);

    // Timestamps are taken just after acquire returns, so allow some scheduling slack
    long slackNanos = TimeUnit.MILLISECONDS.toNanos(100);
    for (int i = 0; i + maxCalls < sorted.size(); i++) {
      long gap = sorted.get(i + maxCalls) - sorted.get(i);
      assertThat(gap).isGreaterThanOrEqualTo(window.toNanos() - slackNanos);
    }
  }

  @Test
  void acquire_shouldStopWaitingWhenCancelled() throws Exception {
    RateLimiter limiter = new RateLimiter(1, Duration.ofMinutes(10));
    CancellationToken token = new CancellationToken();
    limiter.acquire(token);

    ExecutorService pool = Executors.newSingleThreadExecutor();
    Future<?> waiting =
        pool.submit(
            () -> {
              limiter.acquire(token);
              return null;
            });
    Thread.sleep(100);
    token.cancel();

    assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS))
        .hasCauseInstanceOf(CancellationException.class);
    pool.shutdown();
  }

  @Test
  void constructor_shouldRejectInvalidSettings() {
    assertThatThrownBy(() -> new RateLimiter(0, Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RateLimiter(1, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
