package com.scholary.orchestrator.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.orchestrator.config.OrchestratorProperties;
import com.scholary.orchestrator.config.OrchestratorProperties.JobsProperties;
import com.scholary.orchestrator.config.OrchestratorProperties.RateLimitProperties;
import com.scholary.orchestrator.config.OrchestratorProperties.ResultsProperties;
import com.scholary.orchestrator.config.OrchestratorProperties.RetryProperties;
import com.scholary.orchestrator.job.ApplyStepUnavailableException;
import com.scholary.orchestrator.job.FailureSummary;
import com.scholary.orchestrator.job.JobKind;
import com.scholary.orchestrator.job.JobManager;
import com.scholary.orchestrator.job.JobNotFinishedException;
import com.scholary.orchestrator.job.JobNotFoundException;
import com.scholary.orchestrator.job.JobOptions;
import com.scholary.orchestrator.job.JobSnapshot;
import com.scholary.orchestrator.job.JobStatus;
import com.scholary.orchestrator.job.NoSavedResultsException;
import com.scholary.orchestrator.job.PipelineNotFoundException;
import com.scholary.orchestrator.job.PipelineRegistry;
import com.scholary.orchestrator.store.ResultDecodeException;
import com.scholary.orchestrator.task.TaskInput;
import com.scholary.orchestrator.task.TaskOutcome;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(JobController.class)
@Import(JobControllerTest.PropertiesConfig.class)
class JobControllerTest {

  @TestConfiguration
  static class PropertiesConfig {
    @Bean
    OrchestratorProperties orchestratorProperties() {
      return new OrchestratorProperties(
          new RateLimitProperties(25, Duration.ofMinutes(1)),
          new RetryProperties(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.3),
          new JobsProperties(2, 10, 100, Duration.ofHours(1), 4),
          new ResultsProperties("filesystem", "build/results"),
          Map.of());
    }
  }

  @Autowired private MockMvc mockMvc;

  @MockBean private PipelineRegistry registry;

  @SuppressWarnings("unchecked")
  private final JobManager<Integer, Integer> manager = mock(JobManager.class);

  @BeforeEach
  void setUp() {
    doReturn(manager).when(registry).manager("numbers");
    when(registry.manager("missing")).thenThrow(new PipelineNotFoundException("Pipeline not found: missing"));
    when(manager.payloadType()).thenReturn(Integer.class);
  }

  @Test
  void pipelines_shouldListRegisteredNames() throws Exception {
    when(registry.names()).thenReturn(List.of("numbers", "prompt"));

    mockMvc
        .perform(get("/api/pipelines"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("numbers"))
        .andExpect(jsonPath("$[1]").value("prompt"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void submit_shouldConvertPayloadsAndReturnAccepted() throws Exception {
    when(manager.submit(anyList(), any(JobOptions.class))).thenReturn("numbers-1");
    when(manager.require("numbers-1")).thenReturn(snapshot("numbers-1", JobStatus.CREATED, 2, List.of()));

    mockMvc
        .perform(
            post("/api/pipelines/numbers/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tasks": [
                      {"key": "a", "payload": 1},
                      {"key": "b", "priorityClass": "high", "payload": 2}
                    ],
                    "concurrency": 2,
                    "priorityOrder": ["high"]}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("numbers-1"))
        .andExpect(jsonPath("$.pipeline").value("numbers"))
        .andExpect(jsonPath("$.total").value(2));

    ArgumentCaptor<List<TaskInput<Integer>>> tasks = ArgumentCaptor.forClass(List.class);
    ArgumentCaptor<JobOptions> options = ArgumentCaptor.forClass(JobOptions.class);
    verify(manager).submit(tasks.capture(), options.capture());
    assertThat(tasks.getValue())
        .containsExactly(new TaskInput<>("a", null, 1), new TaskInput<>("b", "high", 2));
    assertThat(options.getValue()).isEqualTo(new JobOptions(2, List.of("high")));
  }

  @Test
  void submit_shouldUseConfiguredDefaultConcurrency() throws Exception {
    when(manager.submit(anyList(), any(JobOptions.class))).thenReturn("numbers-2");
    when(manager.require("numbers-2")).thenReturn(snapshot("numbers-2", JobStatus.CREATED, 1, List.of()));

    mockMvc
        .perform(
            post("/api/pipelines/numbers/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tasks\": [{\"key\": \"a\", \"payload\": 1}]}"))
        .andExpect(status().isAccepted());

    verify(manager).submit(anyList(), eq(new JobOptions(4, List.of())));
  }

  @Test
  void submit_shouldPassDryRunFlag() throws Exception {
    when(manager.submit(anyList(), any(JobOptions.class))).thenReturn("numbers-5");
    when(manager.require("numbers-5")).thenReturn(snapshot("numbers-5", JobStatus.CREATED, 1, List.of()));

    mockMvc
        .perform(
            post("/api/pipelines/numbers/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tasks\": [{\"key\": \"a\", \"payload\": 1}], \"dryRun\": true}"))
        .andExpect(status().isAccepted());

    verify(manager).submit(anyList(), eq(new JobOptions(4, List.of(), true)));
  }

  @Test
  void submit_shouldRejectPayloadOfWrongType() throws Exception {
    mockMvc
        .perform(
            post("/api/pipelines/numbers/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tasks\": [{\"key\": \"a\", \"payload\": \"abc\"}]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value(startsWith("Invalid payload for task a")));

    verify(manager, never()).submit(anyList(), any(JobOptions.class));
  }

  @Test
  void submit_shouldRejectInvalidRequests() throws Exception {
    mockMvc
        .perform(
            post("/api/pipelines/numbers/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tasks\": [{\"key\": \" \", \"payload\": 1}], \"concurrency\": 0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").exists());

    verify(manager, never()).submit(anyList(), any(JobOptions.class));
  }

  @Test
  void submit_shouldReturnNotFoundForUnknownPipeline() throws Exception {
    mockMvc
        .perform(
            post("/api/pipelines/missing/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tasks\": []}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Pipeline not found: missing"));
  }

  @Test
  void status_shouldReturnCountersAndResults() throws Exception {
    List<TaskOutcome<Integer, Integer>> results =
        List.of(
            TaskOutcome.succeeded(new TaskInput<>("a", null, 1), 10, 0),
            TaskOutcome.failed(new TaskInput<>("b", null, 2), "boom", 2));
    doReturn(Optional.of(snapshot("numbers-1", JobStatus.RUNNING, 3, results)))
        .when(registry)
        .findJob("numbers-1");

    mockMvc
        .perform(get("/api/jobs/numbers-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("RUNNING"))
        .andExpect(jsonPath("$.dryRun").value(false))
        .andExpect(jsonPath("$.total").value(3))
        .andExpect(jsonPath("$.completed").value(2))
        .andExpect(jsonPath("$.succeeded").value(1))
        .andExpect(jsonPath("$.failed").value(1))
        .andExpect(jsonPath("$.results[0].key").value("a"))
        .andExpect(jsonPath("$.results[0].payload").value(10))
        .andExpect(jsonPath("$.results[1].error").value("boom"))
        .andExpect(jsonPath("$.results[1].retries").value(2));
  }

  @Test
  void status_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(registry.findJob("nope")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/jobs/nope")).andExpect(status().isNotFound());
  }

  @Test
  void retryJobFailures_shouldReturnConflictWhileJobIsRunning() throws Exception {
    doReturn(manager).when(registry).managerForJob("numbers-1");
    when(manager.retryFailed(any(), any(JobOptions.class)))
        .thenThrow(new JobNotFinishedException("Job numbers-1 has not finished yet"));

    mockMvc
        .perform(post("/api/jobs/numbers-1/retry-failed"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("Job numbers-1 has not finished yet"));
  }

  @Test
  void retryJobFailures_shouldStartRetryJob() throws Exception {
    doReturn(manager).when(registry).managerForJob("numbers-1");
    when(manager.retryFailed("numbers-1", new JobOptions(1, List.of()))).thenReturn("numbers-3");
    when(manager.require("numbers-3")).thenReturn(snapshot("numbers-3", JobStatus.CREATED, 1, List.of()));

    mockMvc
        .perform(
            post("/api/jobs/numbers-1/retry-failed")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"concurrency\": 1}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("numbers-3"));
  }

  @Test
  void retryLatestFailures_shouldReturnNotFoundWithoutSavedResults() throws Exception {
    when(manager.retryFailedFromLatest(any(JobOptions.class)))
        .thenThrow(new NoSavedResultsException("No saved results for pipeline numbers"));

    mockMvc
        .perform(post("/api/pipelines/numbers/retry-failed"))
        .andExpect(status().isNotFound());
  }

  @Test
  void applySaved_shouldStartApplyJob() throws Exception {
    when(manager.applySaved()).thenReturn("numbers-4");
    when(manager.require("numbers-4")).thenReturn(snapshot("numbers-4", JobStatus.CREATED, 5, List.of()));

    mockMvc
        .perform(post("/api/pipelines/numbers/apply-saved"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.total").value(5));
  }

  @Test
  void applySaved_shouldReturnConflictWithoutApplyStep() throws Exception {
    when(manager.applySaved())
        .thenThrow(new ApplyStepUnavailableException("Pipeline numbers has no apply step"));

    mockMvc
        .perform(post("/api/pipelines/numbers/apply-saved"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("Pipeline numbers has no apply step"));
  }

  @Test
  void cancel_shouldReportWhetherJobWasCancelled() throws Exception {
    doReturn(manager).when(registry).managerForJob("numbers-1");
    when(manager.cancel("numbers-1")).thenReturn(true);
    when(registry.managerForJob("gone")).thenThrow(new JobNotFoundException("Job not found: gone"));

    mockMvc
        .perform(post("/api/jobs/numbers-1/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelled").value(true));
    mockMvc.perform(post("/api/jobs/gone/cancel")).andExpect(status().isNotFound());
  }

  @Test
  void failures_shouldReturnSummaryOfLatestBatch() throws Exception {
    when(manager.failureSummary())
        .thenReturn(
            new FailureSummary(
                "run_20240101_120000",
                "2024-01-01T12:00:00Z",
                List.of(new FailureSummary.Entry("b", "high", "boom"))));

    mockMvc
        .perform(get("/api/pipelines/numbers/results/latest/failures"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.recordId").value("run_20240101_120000"))
        .andExpect(jsonPath("$.failures[0].key").value("b"))
        .andExpect(jsonPath("$.failures[0].error").value("boom"));
  }

  @Test
  void failures_shouldReturnServerErrorForCorruptRecord() throws Exception {
    when(manager.failureSummary())
        .thenThrow(new ResultDecodeException("Failed to decode record run_1", null));

    mockMvc
        .perform(get("/api/pipelines/numbers/results/latest/failures"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Failed to decode record run_1"));
  }

  private static JobSnapshot<Integer, Integer> snapshot(
      String id, JobStatus status, int total, List<TaskOutcome<Integer, Integer>> results) {
    int succeeded = (int) results.stream().filter(TaskOutcome::success).count();
    return new JobSnapshot<>(
        id,
        "numbers",
        JobKind.RUN,
        false,
        status,
        total,
        results.size(),
        succeeded,
        results.size() - succeeded,
        results,
        Instant.parse("2024-01-01T12:00:00Z"),
        null,
        null,
        null,
        null,
        null,
        null,
        null);
  }
}
