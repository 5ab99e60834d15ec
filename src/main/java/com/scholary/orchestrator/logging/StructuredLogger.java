package com.scholary.orchestrator.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Every event carries an {@code event_type} plus its own fields so runs can be queried in
 * Kibana by job, task or event. Job and task context live in the MDC for the duration of a run or a
 * task execution; event fields are removed again after each log call.
 */
public class StructuredLogger {

  public static final String JOB_ID = "jobId";
  public static final String PIPELINE = "pipeline";
  public static final String TASK_KEY = "task_key";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log task started event. */
  public void logTaskStarted(String taskKey, String priorityClass) {
    try {
      MDC.put("event_type", "task_started");
      MDC.put("priorityClass", String.valueOf(priorityClass));

      logger.debug("Task started: key={}, priorityClass={}", taskKey, priorityClass);
    } finally {
      clearEventFields();
    }
  }

  /** Log task finished event. */
  public void logTaskFinished(String taskKey, boolean success, int retries, long durationMs) {
    try {
      MDC.put("event_type", "task_finished");
      MDC.put("success", String.valueOf(success));
      MDC.put("retries", String.valueOf(retries));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.debug(
          "Task finished: key={}, success={}, retries={}, duration={}ms",
          taskKey,
          success,
          retries,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log task skipped because a precondition could not be resolved. */
  public void logTaskSkipped(String taskKey, String reason) {
    try {
      MDC.put("event_type", "task_skipped");
      MDC.put("reason", reason);

      logger.warn("Task skipped: key={}, reason={}", taskKey, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log retry scheduled event. */
  public void logRetry(
      int attempt, int maxRetries, long delayMs, boolean hinted, String errorType, String message) {
    try {
      MDC.put("event_type", "call_retry");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("delayMs", String.valueOf(delayMs));
      MDC.put("hinted", String.valueOf(hinted));
      MDC.put("errorType", errorType);

      logger.warn(
          "Retryable error (attempt {}/{}), retrying in {}ms{}: {}: {}",
          attempt,
          maxRetries,
          delayMs,
          hinted ? " (server hint)" : "",
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log call given up event. */
  public void logCallFailed(String reason, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "call_failed");
      MDC.put("reason", reason);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Call failed ({}) after {} attempt(s): {}: {}", reason, attempts, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log rate limit wait event. */
  public void logRateLimited(int maxCalls, long windowMs, long waitMs) {
    try {
      MDC.put("event_type", "rate_limited");
      MDC.put("maxCalls", String.valueOf(maxCalls));
      MDC.put("windowMs", String.valueOf(windowMs));
      MDC.put("delayMs", String.valueOf(waitMs));

      logger.info(
          "Rate limit reached ({} calls per {}ms), waiting {}ms", maxCalls, windowMs, waitMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int completed, int total, int succeeded, int failed) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("completed", String.valueOf(completed));
      MDC.put("total", String.valueOf(total));
      MDC.put("succeeded", String.valueOf(succeeded));
      MDC.put("failed", String.valueOf(failed));

      logger.info(
          "Job progress: jobId={}, tasks={}/{}, succeeded={}, failed={}",
          jobId,
          completed,
          total,
          succeeded,
          failed);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String pipeline) {
    MDC.put(JOB_ID, jobId);
    MDC.put(PIPELINE, pipeline);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove(JOB_ID);
    MDC.remove(PIPELINE);
  }

  /** Set task context in MDC. */
  public static void setTaskContext(String taskKey) {
    MDC.put(TASK_KEY, taskKey);
  }

  /** Clear task context from MDC. */
  public static void clearTaskContext() {
    MDC.remove(TASK_KEY);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("priorityClass");
    MDC.remove("success");
    MDC.remove("retries");
    MDC.remove("durationMs");
    MDC.remove("reason");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("delayMs");
    MDC.remove("hinted");
    MDC.remove("errorType");
    MDC.remove("maxCalls");
    MDC.remove("windowMs");
    MDC.remove("completed");
    MDC.remove("total");
    MDC.remove("succeeded");
    MDC.remove("failed");
  }
}
