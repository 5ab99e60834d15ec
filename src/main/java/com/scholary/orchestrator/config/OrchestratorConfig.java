package com.scholary.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.config.OrchestratorProperties.RateLimitProperties;
import com.scholary.orchestrator.job.JobManager;
import com.scholary.orchestrator.job.JobRepository;
import com.scholary.orchestrator.job.Pipeline;
import com.scholary.orchestrator.job.PipelineRegistry;
import com.scholary.orchestrator.ratelimit.RateLimiter;
import com.scholary.orchestrator.retry.RetryExecutor;
import com.scholary.orchestrator.retry.RetryPolicy;
import com.scholary.orchestrator.scheduler.Scheduler;
import com.scholary.orchestrator.store.FileSystemResultStoreFactory;
import com.scholary.orchestrator.store.ResultStoreFactory;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires one job manager per registered pipeline.
 *
 * <p>Every pipeline gets its own rate limiter, retry executor, scheduler and result store. The job
 * registry and the launcher executor are shared.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(OrchestratorConfig.class);

  @Bean
  public JobRepository jobRepository(OrchestratorProperties properties) {
    return new JobRepository(
        properties.jobs().maxRetained(), properties.jobs().expireAfterAccess());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "orchestrator.results",
      name = "backend",
      havingValue = "filesystem",
      matchIfMissing = true)
  public ResultStoreFactory fileSystemResultStoreFactory(
      OrchestratorProperties properties, ObjectMapper objectMapper) {
    Path directory = Path.of(properties.results().directory());
    LOGGER.info("Batch results are kept on the filesystem: {}", directory.toAbsolutePath());
    return new FileSystemResultStoreFactory(directory, objectMapper);
  }

  @Bean
  public PipelineRegistry pipelineRegistry(
      ObjectProvider<Pipeline<?, ?>> pipelines,
      OrchestratorProperties properties,
      ResultStoreFactory resultStoreFactory,
      JobRepository jobRepository,
      @Qualifier("jobLauncher") Executor jobLauncher) {
    List<JobManager<?, ?>> managers =
        pipelines
            .orderedStream()
            .<JobManager<?, ?>>map(
                pipeline ->
                    managerFor(
                        pipeline, properties, resultStoreFactory, jobRepository, jobLauncher))
            .toList();
    LOGGER.info(
        "Registered pipelines: {}", managers.stream().map(JobManager::pipelineName).toList());
    return new PipelineRegistry(managers, jobRepository);
  }

  private static <P, R> JobManager<P, R> managerFor(
      Pipeline<P, R> pipeline,
      OrchestratorProperties properties,
      ResultStoreFactory resultStoreFactory,
      JobRepository jobRepository,
      Executor jobLauncher) {
    RateLimitProperties rateLimit = properties.rateLimitFor(pipeline.name());
    RateLimiter rateLimiter = new RateLimiter(rateLimit.maxCalls(), rateLimit.window());
    LOGGER.info(
        "Pipeline {} rate limit: {} calls per {}",
        pipeline.name(),
        rateLimit.maxCalls(),
        rateLimit.window());
    RetryPolicy policy =
        new RetryPolicy(
            properties.retry().maxRetries(),
            properties.retry().baseDelay(),
            properties.retry().maxDelay(),
            properties.retry().jitterRatio());
    Scheduler scheduler = new Scheduler(new RetryExecutor(policy, rateLimiter));
    return new JobManager<>(
        pipeline,
        scheduler,
        resultStoreFactory.create(pipeline.name(), pipeline.payloadType(), pipeline.resultType()),
        jobRepository,
        jobLauncher);
  }
}
