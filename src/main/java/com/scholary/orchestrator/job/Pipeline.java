package com.scholary.orchestrator.job;

import com.scholary.orchestrator.task.TaskExecutor;
import com.scholary.orchestrator.task.TaskPrecondition;
import java.util.Optional;

/**
 * A named kind of batch work.
 *
 * <p>Each registered pipeline gets its own job manager, result store, retry executor and rate
 * limiter. Payload types are used to read saved batches back.
 */
public interface Pipeline<P, R> {

  String name();

  Class<P> payloadType();

  Class<R> resultType();

  /**
   * Build the executor for one job.
   *
   * @throws PipelineInitializationException if a required collaborator cannot be set up
   */
  TaskExecutor<P, R> createExecutor();

  default TaskPrecondition<P> precondition() {
    return TaskPrecondition.always();
  }

  default Optional<ApplyStep<P, R>> applyStep() {
    return Optional.empty();
  }
}
