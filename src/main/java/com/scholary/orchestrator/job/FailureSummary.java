package com.scholary.orchestrator.job;

import java.util.List;

/**
 * Failed tasks of the latest saved batch, for human review.
 *
 * @param recordId batch record the failures come from
 * @param timestamp save time of that record
 * @param failures one entry per failed task
 */
public record FailureSummary(String recordId, String timestamp, List<Entry> failures) {

  public record Entry(String key, String priorityClass, String error) {}
}
