package com.scholary.orchestrator.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Request to run a batch on a pipeline.
 *
 * @param tasks the batch; duplicates by key are dropped
 * @param concurrency worker count, or null for the configured default
 * @param priorityOrder priority classes, most urgent first
 * @param dryRun report what the apply step would do without doing it
 */
public record SubmitJobRequest(
    @NotNull @Valid List<TaskRequest> tasks,
    @Positive Integer concurrency,
    List<String> priorityOrder,
    Boolean dryRun) {}
