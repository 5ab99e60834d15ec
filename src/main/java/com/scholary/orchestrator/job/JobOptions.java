package com.scholary.orchestrator.job;

import java.util.List;

/**
 * Per-job scheduling settings.
 *
 * @param concurrency worker count; values below 1 fall back to {@value #DEFAULT_CONCURRENCY}
 * @param priorityOrder priority classes, most urgent first
 * @param dryRun run the apply step without side effects; results are still saved
 */
public record JobOptions(int concurrency, List<String> priorityOrder, boolean dryRun) {

  public static final int DEFAULT_CONCURRENCY = 3;

  public JobOptions {
    concurrency = concurrency < 1 ? DEFAULT_CONCURRENCY : concurrency;
    priorityOrder = priorityOrder == null ? List.of() : List.copyOf(priorityOrder);
  }

  public JobOptions(int concurrency, List<String> priorityOrder) {
    this(concurrency, priorityOrder, false);
  }

  public static JobOptions defaults() {
    return new JobOptions(DEFAULT_CONCURRENCY, List.of());
  }
}
