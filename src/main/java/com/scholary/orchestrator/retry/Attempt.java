package com.scholary.orchestrator.retry;

/**
 * Value returned by a successful retried call.
 *
 * @param value the call's result
 * @param retries number of retries performed before the successful attempt
 */
public record Attempt<T>(T value, int retries) {}
