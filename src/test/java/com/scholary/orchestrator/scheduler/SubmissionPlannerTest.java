package com.scholary.orchestrator.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.orchestrator.task.TaskInput;
import java.util.List;
import org.junit.jupiter.api.Test;

class SubmissionPlannerTest {

  private static TaskInput<String> task(String key, String priorityClass) {
    return new TaskInput<>(key, priorityClass, key + "-payload");
  }

  @Test
  void plan_shouldOrderByPriorityWithUnknownClassesLast() {
    List<TaskInput<String>> planned =
        SubmissionPlanner.plan(
            List.of(
                task("a", "low"),
                task("b", "unknown"),
                task("c", "high"),
                task("d", null),
                task("e", "high"),
                task("f", "low")),
            List.of("high", "low"));

    assertThat(planned)
        .extracting(TaskInput::dedupKey)
        .containsExactly("c", "e", "a", "f", "b", "d");
  }

  @Test
  void plan_shouldKeepFirstOccurrenceAfterSorting() {
    List<TaskInput<String>> planned =
        SubmissionPlanner.plan(
            List.of(task("x", "low"), task("y", "low"), task("x", "high")),
            List.of("high", "low"));

    assertThat(planned).extracting(TaskInput::dedupKey).containsExactly("x", "y");
    assertThat(planned.get(0).priorityClass()).isEqualTo("high");
  }

  @Test
  void plan_shouldKeepInputOrderWithoutPriorityOrder() {
    List<TaskInput<String>> planned =
        SubmissionPlanner.plan(
            List.of(task("3", "b"), task("1", "a"), task("2", "c"), task("1", "z")), List.of());

    assertThat(planned).extracting(TaskInput::dedupKey).containsExactly("3", "1", "2");
  }
}
