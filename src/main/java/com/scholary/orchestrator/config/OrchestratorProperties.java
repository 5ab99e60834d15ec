package com.scholary.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for batch orchestration.
 *
 * <p>Rate limiting and retry settings apply to each pipeline separately: every pipeline gets its
 * own limiter and retry executor built from them. {@code pipelines.<name>.rate-limit} replaces the
 * global rate limit for one pipeline.
 */
@ConfigurationProperties(prefix = "orchestrator")
@Validated
public record OrchestratorProperties(
    @Valid @NotNull RateLimitProperties rateLimit,
    @Valid @NotNull RetryProperties retry,
    @Valid @NotNull JobsProperties jobs,
    @Valid @NotNull ResultsProperties results,
    @Valid Map<String, PipelineProperties> pipelines) {

  public OrchestratorProperties {
    pipelines = pipelines == null ? Map.of() : Map.copyOf(pipelines);
  }

  /** Rate limit of one pipeline: its own override if configured, the global one otherwise. */
  public RateLimitProperties rateLimitFor(String pipeline) {
    PipelineProperties overrides = pipelines.get(pipeline);
    return overrides != null && overrides.rateLimit() != null ? overrides.rateLimit() : rateLimit;
  }

  public record RateLimitProperties(@Positive int maxCalls, @NotNull Duration window) {}

  public record RetryProperties(
      @Positive int maxRetries,
      @NotNull Duration baseDelay,
      @NotNull Duration maxDelay,
      @PositiveOrZero double jitterRatio) {}

  public record JobsProperties(
      @Positive int launcherThreads,
      @Positive int launcherQueueSize,
      @Positive long maxRetained,
      @NotNull Duration expireAfterAccess,
      @Positive int defaultConcurrency) {}

  public record ResultsProperties(@NotBlank String backend, @NotBlank String directory) {}

  public record PipelineProperties(@Valid RateLimitProperties rateLimit) {}
}
