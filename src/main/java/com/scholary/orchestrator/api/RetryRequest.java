package com.scholary.orchestrator.api;

import jakarta.validation.constraints.Positive;
import java.util.List;

/** Optional scheduling settings for a retry; the request body may be omitted. */
public record RetryRequest(
    @Positive Integer concurrency, List<String> priorityOrder, Boolean dryRun) {}
