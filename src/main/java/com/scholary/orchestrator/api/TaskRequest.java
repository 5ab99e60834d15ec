package com.scholary.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

/**
 * One task in a submit request.
 *
 * @param key dedup key
 * @param priorityClass optional priority class
 * @param payload pipeline-specific payload
 */
public record TaskRequest(@NotBlank String key, String priorityClass, JsonNode payload) {}
