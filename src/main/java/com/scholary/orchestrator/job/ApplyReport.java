package com.scholary.orchestrator.job;

import java.util.List;

/**
 * What an apply step did with a batch's successful outcomes.
 *
 * @param applied outcomes applied
 * @param skipped outcomes left untouched
 * @param details one line per noteworthy item
 */
public record ApplyReport(int applied, int skipped, List<String> details) {

  public ApplyReport {
    details = details == null ? List.of() : List.copyOf(details);
  }
}
