package com.scholary.orchestrator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.job.ApplyStep;
import com.scholary.orchestrator.job.Pipeline;
import com.scholary.orchestrator.job.PipelineInitializationException;
import com.scholary.orchestrator.task.TaskExecutor;
import com.scholary.orchestrator.task.TaskPrecondition;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Pipeline that runs prompt templates against an OpenAI-compatible model.
 *
 * <p>Tasks naming an unknown template are skipped. A missing API key fails the job before any
 * task runs. When an export directory is configured, parsed replies are exported by the apply
 * step.
 */
@Component
public class PromptPipeline implements Pipeline<JsonNode, JsonNode> {

  private static final Logger LOGGER = LoggerFactory.getLogger(PromptPipeline.class);

  public static final String NAME = "prompt";

  private final LlmProperties properties;
  private final ObjectMapper objectMapper;
  private final PromptTemplates templates;
  private final Function<LlmProperties, LlmClient> clientFactory;

  @Autowired
  public PromptPipeline(LlmProperties properties, ObjectMapper objectMapper) {
    this(properties, objectMapper, p -> new OpenAiLlmClient(p, objectMapper));
  }

  PromptPipeline(
      LlmProperties properties,
      ObjectMapper objectMapper,
      Function<LlmProperties, LlmClient> clientFactory) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.templates = new PromptTemplates(properties.templates());
    this.clientFactory = clientFactory;
    LOGGER.info("Prompt pipeline loaded {} templates", templates.size());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Class<JsonNode> payloadType() {
    return JsonNode.class;
  }

  @Override
  public Class<JsonNode> resultType() {
    return JsonNode.class;
  }

  @Override
  public TaskExecutor<JsonNode, JsonNode> createExecutor() {
    if (!properties.hasApiKey()) {
      throw new PipelineInitializationException(
          "LLM API key is not configured (set OPENAI_API_KEY or orchestrator.llm.api-key)");
    }
    return new PromptTaskExecutor(clientFactory.apply(properties), templates, objectMapper);
  }

  @Override
  public TaskPrecondition<JsonNode> precondition() {
    return input -> {
      JsonNode payload = input.payload();
      if (payload == null || !payload.hasNonNull(PromptTaskExecutor.TEMPLATE_FIELD)) {
        return Optional.of("Payload has no template");
      }
      String template = payload.get(PromptTaskExecutor.TEMPLATE_FIELD).asText();
      return templates.contains(template)
          ? Optional.empty()
          : Optional.of("Template not found: " + template);
    };
  }

  @Override
  public Optional<ApplyStep<JsonNode, JsonNode>> applyStep() {
    if (properties.exportDirectory() == null || properties.exportDirectory().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new ReplyExportStep(Path.of(properties.exportDirectory()), objectMapper));
  }
}
