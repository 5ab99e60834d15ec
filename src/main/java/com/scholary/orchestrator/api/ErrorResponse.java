package com.scholary.orchestrator.api;

/** Error body returned by the API. */
public record ErrorResponse(String error) {}
