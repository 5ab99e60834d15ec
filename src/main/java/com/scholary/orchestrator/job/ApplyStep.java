package com.scholary.orchestrator.job;

import com.scholary.orchestrator.task.TaskOutcome;
import java.util.List;

/**
 * Side effect applied once a run has finished, over its successful outcomes.
 *
 * <p>This is the only place a pipeline mutates shared state; task executors only compute. In a dry
 * run the step reports what it would do and changes nothing.
 */
@FunctionalInterface
public interface ApplyStep<P, R> {

  ApplyReport apply(List<TaskOutcome<P, R>> successful, boolean dryRun) throws Exception;
}
