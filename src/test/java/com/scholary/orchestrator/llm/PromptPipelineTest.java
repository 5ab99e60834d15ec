package com.scholary.orchestrator.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.job.PipelineInitializationException;
import com.scholary.orchestrator.task.TaskInput;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PromptPipelineTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @TempDir Path exportDir;

  @Test
  void createExecutor_shouldFailWithoutApiKey() {
    PromptPipeline pipeline = pipeline(" ", null);

    assertThatThrownBy(pipeline::createExecutor)
        .isInstanceOf(PipelineInitializationException.class)
        .hasMessageContaining("API key");
  }

  @Test
  void createExecutor_shouldUseConfiguredClient() {
    PromptPipeline pipeline = pipeline("key", null);

    assertThat(pipeline.createExecutor()).isInstanceOf(PromptTaskExecutor.class);
  }

  @Test
  void precondition_shouldRejectMissingOrUnknownTemplates() throws Exception {
    PromptPipeline pipeline = pipeline("key", null);

    assertThat(pipeline.precondition().unresolved(input("{\"template\":\"summarize\"}"))).isEmpty();
    assertThat(pipeline.precondition().unresolved(input("{\"variables\":{}}")))
        .contains("Payload has no template");
    assertThat(pipeline.precondition().unresolved(input("{\"template\":\"translate\"}")))
        .contains("Template not found: translate");
  }

  @Test
  void applyStep_shouldOnlyExistWhenExportDirectoryIsSet() {
    assertThat(pipeline("key", null).applyStep()).isEmpty();
    assertThat(pipeline("key", exportDir.toString()).applyStep())
        .get()
        .isInstanceOf(ReplyExportStep.class);
  }

  @Test
  void types_shouldBeJson() {
    PromptPipeline pipeline = pipeline("key", null);

    assertThat(pipeline.name()).isEqualTo(PromptPipeline.NAME);
    assertThat(pipeline.payloadType()).isEqualTo(JsonNode.class);
    assertThat(pipeline.resultType()).isEqualTo(JsonNode.class);
  }

  private PromptPipeline pipeline(String apiKey, String exportDirectory) {
    LlmProperties properties =
        new LlmProperties(
            "http://localhost:1/v1",
            apiKey,
            "gpt-test",
            5,
            5,
            true,
            Map.of("summarize", "Summarize: {{text}}"),
            exportDirectory);
    return new PromptPipeline(properties, objectMapper, p -> prompt -> "{}");
  }

  private TaskInput<JsonNode> input(String json) throws Exception {
    return new TaskInput<>("k", null, objectMapper.readTree(json));
  }
}
