package com.scholary.orchestrator.scheduler;

import com.scholary.orchestrator.task.TaskInput;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders and deduplicates a batch before it is handed to workers.
 *
 * <p>Tasks are stable-sorted by the position of their priority class in the priority order, with
 * unknown or missing classes after all known ones. Duplicates by dedup key are dropped afterwards,
 * so the task that sorts first wins.
 */
public final class SubmissionPlanner {

  private SubmissionPlanner() {}

  public static <P> List<TaskInput<P>> plan(List<TaskInput<P>> tasks, List<String> priorityOrder) {
    Map<String, Integer> rank = new HashMap<>();
    if (priorityOrder != null) {
      for (int i = 0; i < priorityOrder.size(); i++) {
        rank.putIfAbsent(priorityOrder.get(i), i);
      }
    }
    int unknown = rank.size();

    List<TaskInput<P>> sorted = new ArrayList<>(tasks);
    sorted.sort(
        Comparator.comparingInt(
            task -> task.priorityClass() == null
                ? unknown
                : rank.getOrDefault(task.priorityClass(), unknown)));

    Set<String> seen = new HashSet<>();
    List<TaskInput<P>> planned = new ArrayList<>(sorted.size());
    for (TaskInput<P> task : sorted) {
      if (seen.add(task.dedupKey())) {
        planned.add(task);
      }
    }
    return planned;
  }
}
