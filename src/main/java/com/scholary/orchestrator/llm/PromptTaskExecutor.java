package com.scholary.orchestrator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.task.TaskExecutor;
import com.scholary.orchestrator.task.TaskInput;
import com.scholary.orchestrator.task.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a task's prompt, sends it to the model and parses the JSON reply.
 *
 * <p>Payload shape: {@code {"template": "<name>", "variables": {...}}}. A reply that is not valid
 * JSON is a task failure, not an error: asking again would cost quota for the same answer.
 */
public class PromptTaskExecutor implements TaskExecutor<JsonNode, JsonNode> {

  private static final Logger LOGGER = LoggerFactory.getLogger(PromptTaskExecutor.class);

  static final String TEMPLATE_FIELD = "template";
  static final String VARIABLES_FIELD = "variables";

  private final LlmClient client;
  private final PromptTemplates templates;
  private final ObjectMapper objectMapper;

  public PromptTaskExecutor(LlmClient client, PromptTemplates templates, ObjectMapper objectMapper) {
    this.client = client;
    this.templates = templates;
    this.objectMapper = objectMapper;
  }

  @Override
  public TaskResult<JsonNode> execute(TaskInput<JsonNode> input) throws Exception {
    String templateName = input.payload().path(TEMPLATE_FIELD).asText(null);
    String template =
        templates
            .find(templateName)
            .orElseThrow(
                () -> new IllegalArgumentException("Template not found: " + templateName));

    String prompt = templates.render(template, input.payload().get(VARIABLES_FIELD));
    String reply = client.complete(prompt);

    try {
      return TaskResult.success(objectMapper.readTree(stripCodeFence(reply)));
    } catch (JsonProcessingException e) {
      LOGGER.error(
          "JSON parse error for task {}: {} (reply starts with: {})",
          input.dedupKey(),
          e.getOriginalMessage(),
          reply.substring(0, Math.min(200, reply.length())));
      return TaskResult.failure("JSON parse: " + e.getOriginalMessage());
    }
  }

  /** Models sometimes wrap JSON in a markdown code fence. */
  static String stripCodeFence(String reply) {
    String trimmed = reply.strip();
    if (!trimmed.startsWith("```")) {
      return trimmed;
    }
    int firstNewline = trimmed.indexOf('\n');
    int closing = trimmed.lastIndexOf("```");
    if (firstNewline < 0 || closing <= firstNewline) {
      return trimmed;
    }
    return trimmed.substring(firstNewline + 1, closing).strip();
  }
}
