package com.scholary.orchestrator.api;

/**
 * Response for a started job.
 *
 * <p>Returns the job ID to poll for status.
 */
public record AsyncJobResponse(String jobId, String pipeline, int total) {}
