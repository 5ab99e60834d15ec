package com.scholary.orchestrator.llm;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the LLM prompt pipeline.
 *
 * <p>The API key is not validated at startup: a missing key only fails the jobs that need it.
 * Templates are read-only for the lifetime of the application.
 */
@ConfigurationProperties(prefix = "orchestrator.llm")
@Validated
public record LlmProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    boolean jsonResponse,
    Map<String, String> templates,
    String exportDirectory) {

  public LlmProperties {
    templates = templates == null ? Map.of() : Map.copyOf(templates);
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
