package com.scholary.orchestrator.job;

/** How a job came to be. */
public enum JobKind {
  /** A batch submitted by a client. */
  RUN,
  /** The failed tasks of an earlier batch, submitted again. */
  RETRY_FAILED,
  /** The apply step replayed over the successes of the latest saved batch. */
  APPLY_SAVED
}
