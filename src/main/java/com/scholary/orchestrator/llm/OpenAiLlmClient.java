package com.scholary.orchestrator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.orchestrator.retry.RemoteCallException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for an OpenAI-compatible chat-completions API.
 *
 * <p>Makes exactly one request per call. Retries, backoff and rate limiting are the retry
 * executor's job: error statuses are raised as {@link RemoteCallException} carrying the status code
 * and any {@code Retry-After} header so they can be classified there.
 */
public class OpenAiLlmClient implements LlmClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

  private final HttpClient httpClient;
  private final LlmProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiLlmClient(LlmProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized LLM client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public String complete(String prompt) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(stripTrailingSlash(properties.baseUrl()) + "/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + properties.apiKey())
            .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(requestBody(prompt))))
            .build();

    LOGGER.debug("Sending chat completion request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() / 100 != 2) {
      throw new RemoteCallException(
          response.statusCode(),
          String.format("LLM API returned status %d: %s", response.statusCode(), response.body()),
          response.headers().firstValue("Retry-After").flatMap(OpenAiLlmClient::parseRetryAfter)
              .orElse(null));
    }

    JsonNode content = objectMapper.readTree(response.body()).at("/choices/0/message/content");
    if (content.isMissingNode() || content.isNull()) {
      throw new IOException("LLM API response has no message content");
    }
    return content.asText();
  }

  private ObjectNode requestBody(String prompt) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    ObjectNode message = body.putArray("messages").addObject();
    message.put("role", "user");
    message.put("content", prompt);
    if (properties.jsonResponse()) {
      body.putObject("response_format").put("type", "json_object");
    }
    return body;
  }

  static Optional<Duration> parseRetryAfter(String header) {
    try {
      return Optional.of(Duration.ofSeconds(Long.parseLong(header.trim())));
    } catch (NumberFormatException e) {
      LOGGER.debug("Ignoring non-numeric Retry-After header: {}", header);
      return Optional.empty();
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
