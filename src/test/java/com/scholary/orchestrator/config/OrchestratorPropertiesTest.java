package com.scholary.orchestrator.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.orchestrator.config.OrchestratorProperties.JobsProperties;
import com.scholary.orchestrator.config.OrchestratorProperties.PipelineProperties;
import com.scholary.orchestrator.config.OrchestratorProperties.RateLimitProperties;
import com.scholary.orchestrator.config.OrchestratorProperties.ResultsProperties;
import com.scholary.orchestrator.config.OrchestratorProperties.RetryProperties;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class OrchestratorPropertiesTest {

  private static final RateLimitProperties GLOBAL =
      new RateLimitProperties(25, Duration.ofMinutes(1));

  private static OrchestratorProperties properties(Map<String, PipelineProperties> pipelines) {
    return new OrchestratorProperties(
        GLOBAL,
        new RetryProperties(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.3),
        new JobsProperties(2, 10, 100, Duration.ofHours(1), 4),
        new ResultsProperties("filesystem", "build/results"),
        pipelines);
  }

  @Test
  void rateLimitFor_shouldPreferPipelineOverride() {
    RateLimitProperties prompt = new RateLimitProperties(5, Duration.ofSeconds(10));
    OrchestratorProperties properties =
        properties(Map.of("prompt", new PipelineProperties(prompt)));

    assertThat(properties.rateLimitFor("prompt")).isEqualTo(prompt);
    assertThat(properties.rateLimitFor("echo")).isEqualTo(GLOBAL);
  }

  @Test
  void rateLimitFor_shouldFallBackWhenOverrideHasNoRateLimit() {
    OrchestratorProperties properties =
        properties(Map.of("prompt", new PipelineProperties(null)));

    assertThat(properties.rateLimitFor("prompt")).isEqualTo(GLOBAL);
    assertThat(properties(null).pipelines()).isEmpty();
  }

  @Test
  void bind_shouldReadPipelineRateLimits() {
    Map<String, String> source = new HashMap<>();
    source.put("orchestrator.rate-limit.max-calls", "25");
    source.put("orchestrator.rate-limit.window", "60s");
    source.put("orchestrator.retry.max-retries", "3");
    source.put("orchestrator.retry.base-delay", "1s");
    source.put("orchestrator.retry.max-delay", "60s");
    source.put("orchestrator.retry.jitter-ratio", "0.3");
    source.put("orchestrator.jobs.launcher-threads", "2");
    source.put("orchestrator.jobs.launcher-queue-size", "10");
    source.put("orchestrator.jobs.max-retained", "100");
    source.put("orchestrator.jobs.expire-after-access", "1h");
    source.put("orchestrator.jobs.default-concurrency", "4");
    source.put("orchestrator.results.backend", "filesystem");
    source.put("orchestrator.results.directory", "build/results");
    source.put("orchestrator.pipelines.prompt.rate-limit.max-calls", "3");
    source.put("orchestrator.pipelines.prompt.rate-limit.window", "1s");

    OrchestratorProperties properties =
        new Binder(new MapConfigurationPropertySource(source))
            .bind("orchestrator", OrchestratorProperties.class)
            .get();

    assertThat(properties.rateLimitFor("prompt"))
        .isEqualTo(new RateLimitProperties(3, Duration.ofSeconds(1)));
    assertThat(properties.rateLimitFor("echo")).isEqualTo(GLOBAL);
  }
}
