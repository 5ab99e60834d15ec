package com.scholary.orchestrator.scheduler;

import com.scholary.orchestrator.concurrent.CancellationToken;
import com.scholary.orchestrator.logging.StructuredLogger;
import com.scholary.orchestrator.retry.Attempt;
import com.scholary.orchestrator.retry.RetryExecutor;
import com.scholary.orchestrator.retry.RetryFailedException;
import com.scholary.orchestrator.retry.RetryFailedException.Reason;
import com.scholary.orchestrator.task.TaskExecutor;
import com.scholary.orchestrator.task.TaskInput;
import com.scholary.orchestrator.task.TaskOutcome;
import com.scholary.orchestrator.task.TaskResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs a batch of tasks on a fixed number of workers.
 *
 * <p>The batch is ordered and deduplicated by {@link SubmissionPlanner}, then {@code
 * min(concurrency, n)} workers drain a shared queue. Each task goes through the precondition, then
 * through the {@link RetryExecutor}. Whatever a task does, it produces exactly one {@link
 * TaskOutcome}: errors are turned into failed outcomes and never stop the other tasks.
 *
 * <p>Outcomes are handed to the listener on the calling thread, one at a time, in the order tasks
 * finish.
 */
public class Scheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(Scheduler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String CANCELLED = "Cancelled";
  static final String INTERRUPTED = "Interrupted";

  private final RetryExecutor retryExecutor;

  public Scheduler(RetryExecutor retryExecutor) {
    this.retryExecutor = retryExecutor;
  }

  /**
   * Run a batch and block until every task has an outcome.
   *
   * @return outcomes in completion order, one per planned task
   * @throws InterruptedException if the calling thread is interrupted; workers are stopped and the
   *     outcomes not yet delivered are lost to the caller
   */
  public <P, R> List<TaskOutcome<P, R>> run(
      List<TaskInput<P>> tasks,
      TaskExecutor<P, R> executor,
      SchedulerOptions<P> options,
      OutcomeListener<P, R> listener,
      CancellationToken token)
      throws InterruptedException {

    List<TaskInput<P>> planned = SubmissionPlanner.plan(tasks, options.priorityOrder());
    if (planned.isEmpty()) {
      return List.of();
    }

    int workers = Math.min(options.concurrency(), planned.size());
    LOGGER.info("Running {} tasks on {} workers", planned.size(), workers);

    Queue<TaskInput<P>> pending = new ConcurrentLinkedQueue<>(planned);
    BlockingQueue<TaskOutcome<P, R>> completions = new LinkedBlockingQueue<>();
    Map<String, String> context = MDC.getCopyOfContextMap();

    ExecutorService pool =
        Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("task-worker-"));
    try {
      for (int i = 0; i < workers; i++) {
        pool.execute(() -> drain(pending, completions, executor, options, token, context));
      }

      List<TaskOutcome<P, R>> outcomes = new ArrayList<>(planned.size());
      for (int i = 0; i < planned.size(); i++) {
        TaskOutcome<P, R> outcome = completions.take();
        outcomes.add(outcome);
        listener.onOutcome(outcome);
      }
      return outcomes;
    } finally {
      pool.shutdownNow();
    }
  }

  private <P, R> void drain(
      Queue<TaskInput<P>> pending,
      BlockingQueue<TaskOutcome<P, R>> completions,
      TaskExecutor<P, R> executor,
      SchedulerOptions<P> options,
      CancellationToken token,
      Map<String, String> context) {
    if (context != null) {
      MDC.setContextMap(context);
    }
    try {
      TaskInput<P> task;
      while ((task = pending.poll()) != null) {
        if (token.isCancelled()) {
          completions.add(TaskOutcome.failed(task, CANCELLED, 0));
          continue;
        }
        if (Thread.currentThread().isInterrupted()) {
          completions.add(TaskOutcome.failed(task, INTERRUPTED, 0));
          continue;
        }
        completions.add(runOne(task, executor, options, token));
      }
    } finally {
      MDC.clear();
    }
  }

  private <P, R> TaskOutcome<P, R> runOne(
      TaskInput<P> task,
      TaskExecutor<P, R> executor,
      SchedulerOptions<P> options,
      CancellationToken token) {
    StructuredLogger.setTaskContext(task.dedupKey());
    long start = System.currentTimeMillis();
    TaskOutcome<P, R> outcome;
    try {
      outcome = execute(task, executor, options, token);
    } finally {
      StructuredLogger.clearTaskContext();
    }
    structuredLogger.logTaskFinished(
        task.dedupKey(), outcome.success(), outcome.retries(), System.currentTimeMillis() - start);
    return outcome;
  }

  private <P, R> TaskOutcome<P, R> execute(
      TaskInput<P> task,
      TaskExecutor<P, R> executor,
      SchedulerOptions<P> options,
      CancellationToken token) {
    try {
      Optional<String> unresolved = options.precondition().unresolved(task);
      if (unresolved.isPresent()) {
        structuredLogger.logTaskSkipped(task.dedupKey(), unresolved.get());
        return TaskOutcome.failed(task, unresolved.get(), 0);
      }

      structuredLogger.logTaskStarted(task.dedupKey(), task.priorityClass());
      Attempt<TaskResult<R>> attempt = retryExecutor.call(() -> executor.execute(task), token);
      if (attempt.value() == null) {
        return TaskOutcome.failed(task, "Executor returned no result", attempt.retries());
      }
      return TaskOutcome.from(task, attempt.value(), attempt.retries());

    } catch (RetryFailedException e) {
      String error = e.reason() == Reason.CANCELLED ? CANCELLED : e.getMessage();
      return TaskOutcome.failed(task, error, Math.max(0, e.attempts() - 1));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return TaskOutcome.failed(task, INTERRUPTED, 0);
    } catch (RuntimeException | Error e) {
      LOGGER.error("Unexpected error in task {}", task.dedupKey(), e);
      return TaskOutcome.failed(task, "Unexpected error: " + describe(e), 0);
    }
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank()
        ? error.getClass().getSimpleName()
        : error.getClass().getSimpleName() + ": " + message;
  }
}
