package com.scholary.orchestrator.job;

/** Exception thrown when saved results are to be applied on a pipeline without an apply step. */
public class ApplyStepUnavailableException extends RuntimeException {

  public ApplyStepUnavailableException(String message) {
    super(message);
  }
}
